package com.demo.trends.service.dto;

public record ExtraTrend(String category, double trendScore) {
}
