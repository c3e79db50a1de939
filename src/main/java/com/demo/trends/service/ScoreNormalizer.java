package com.demo.trends.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Min-max scaling of non-negative signals into [0,1].
 * Negative inputs count as 0; a sequence without spread (empty, single value, all equal) maps to zeros.
 */
public final class ScoreNormalizer {

    private ScoreNormalizer() {}

    public static List<Double> normalize(List<? extends Number> values) {
        if (values == null || values.isEmpty()) return Collections.emptyList();

        List<Double> clamped = new ArrayList<>(values.size());
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (Number n : values) {
            double v = (n == null) ? 0.0 : Math.max(0.0, n.doubleValue());
            clamped.add(v);
            min = Math.min(min, v);
            max = Math.max(max, v);
        }

        List<Double> out = new ArrayList<>(clamped.size());
        if (max == min) {
            for (int i = 0; i < clamped.size(); i++) out.add(0.0);
            return out;
        }
        double range = max - min;
        for (double v : clamped) out.add((v - min) / range);
        return out;
    }

    public static double round(double v, int decimals) {
        double f = Math.pow(10, decimals);
        return Math.round(v * f) / f;
    }
}
