package com.demo.trends.service.dto;

public record CuratedTrend(String category, double score, String note) {
}
