package com.demo.trends.service;

import com.demo.trends.service.dto.ClusterSummary;
import com.demo.trends.service.dto.Combination;
import com.demo.trends.service.dto.CombinedEntry;
import com.demo.trends.service.dto.ExtraTrend;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Joins trend scores with cluster popularity by category.
 * combined = 0.6 * trend + 0.4 * normalized cluster count.
 */
@Component
public class SignalCombiner {

    public static final double TREND_WEIGHT = 0.6;
    public static final double POPULATION_WEIGHT = 0.4;
    public static final int MAX_OUTPUT_SAMPLES = 3;

    public Combination combine(Map<String, Double> trendScores, List<ClusterSummary> clusters) {
        List<Integer> counts = clusters.stream().map(ClusterSummary::count).toList();
        List<Double> pop = ScoreNormalizer.normalize(counts);

        List<CombinedEntry> entries = new ArrayList<>(clusters.size());
        Set<String> matched = new HashSet<>();
        for (int i = 0; i < clusters.size(); i++) {
            ClusterSummary c = clusters.get(i);
            String category = categoryOf(c);
            double trend = trendScores.getOrDefault(category, 0.0);
            double p = pop.get(i);
            List<Integer> refs = c.sampleRefs().subList(0, Math.min(MAX_OUTPUT_SAMPLES, c.sampleRefs().size()));
            entries.add(new CombinedEntry(c.clusterId(), category, p, trend,
                    TREND_WEIGHT * trend + POPULATION_WEIGHT * p, List.copyOf(refs)));
            matched.add(category);
        }

        List<ExtraTrend> extras = new ArrayList<>();
        for (Map.Entry<String, Double> e : trendScores.entrySet()) {
            if (!matched.contains(e.getKey())) extras.add(new ExtraTrend(e.getKey(), e.getValue()));
        }
        return new Combination(entries, extras);
    }

    static String categoryOf(ClusterSummary c) {
        String hint = c.labelHint();
        return (hint != null && !hint.isBlank()) ? hint : "cluster_" + c.clusterId();
    }
}
