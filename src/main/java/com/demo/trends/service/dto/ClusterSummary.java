package com.demo.trends.service.dto;

import java.util.List;

/**
 * One cluster of a summary run.
 *
 * @param sampleRefs   original dataset indices, at most {@link #MAX_SAMPLE_REFS}
 * @param labelHint    display label, may be null
 * @param centroidNorm Euclidean norm of the centroid in reduced space; null for synthetic clusters
 */
public record ClusterSummary(int clusterId, int count, List<Integer> sampleRefs,
                             String labelHint, Double centroidNorm) {

    public static final int MAX_SAMPLE_REFS = 5;

    public ClusterSummary {
        if (clusterId < 0) throw new IllegalArgumentException("clusterId must be >= 0");
        if (count < 0) throw new IllegalArgumentException("count must be >= 0");
        sampleRefs = (sampleRefs == null) ? List.of()
                : List.copyOf(sampleRefs.subList(0, Math.min(MAX_SAMPLE_REFS, sampleRefs.size())));
    }

    public static ClusterSummary of(int clusterId, int count, String labelHint) {
        return new ClusterSummary(clusterId, count, List.of(), labelHint, null);
    }
}
