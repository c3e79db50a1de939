package com.demo.trends.service.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Category scores in [0,1] plus where they came from. {@code error} is set only for provider fallbacks. */
public record TrendScores(TrendSource source, Map<String, Double> scores, String timeframe, String error) {

    public TrendScores {
        scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    public static TrendScores provider(Map<String, Double> scores, String timeframe) {
        return new TrendScores(TrendSource.PROVIDER, scores, timeframe, null);
    }

    public static TrendScores mock(Map<String, Double> scores) {
        return new TrendScores(TrendSource.MOCK, scores, null, null);
    }

    public static TrendScores fallback(Map<String, Double> scores, String error) {
        return new TrendScores(TrendSource.FALLBACK_PROVIDER_ERROR, scores, null, error);
    }

    public static TrendScores curated(Map<String, Double> scores) {
        return new TrendScores(TrendSource.CURATED, scores, null, null);
    }
}
