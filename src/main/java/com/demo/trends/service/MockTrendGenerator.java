package com.demo.trends.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stable pseudo trend scores for when no live provider data exists.
 * No randomness and no I/O: a category string always gets the same raw score.
 */
@Component
public class MockTrendGenerator {

    static final double RAW_FLOOR = 0.01;
    static final double RAW_CEIL = 1.0;

    public Map<String, Double> mockScores(Collection<String> categories) {
        Map<String, Double> raw = new LinkedHashMap<>();
        if (categories == null) return raw;
        for (String c : categories) {
            if (c == null || raw.containsKey(c)) continue;
            raw.put(c, rawScore(c));
        }

        List<Double> normed = ScoreNormalizer.normalize(new ArrayList<>(raw.values()));
        Map<String, Double> out = new LinkedHashMap<>();
        int i = 0;
        for (String c : raw.keySet()) {
            out.put(c, ScoreNormalizer.round(normed.get(i++), 3));
        }
        return out;
    }

    double rawScore(String category) {
        int h = HashUtil.bucket(category, 1000);
        double base = ((h % 70) + (category.length() % 30)) / 100.0;
        return ScoreNormalizer.round(Math.min(RAW_CEIL, Math.max(RAW_FLOOR, base)), 3);
    }
}
