package com.demo.trends.service.dto;

import java.util.List;

public record Combination(List<CombinedEntry> entries, List<ExtraTrend> extraTrends) {
}
