package com.demo.trends.service.dto;

import java.util.List;

/** Result of one summarizer computation; {@code sampled} is only known on the live path. */
public record ClusterRun(List<ClusterSummary> clusters, ClusterSource source, Integer sampled) {

    public ClusterRun {
        clusters = List.copyOf(clusters);
    }

    public int totalCount() {
        return clusters.stream().mapToInt(ClusterSummary::count).sum();
    }
}
