package com.demo.trends.service.clustering;

import com.demo.trends.service.InvalidRequestException;
import com.demo.trends.service.dto.ClusterRun;
import com.demo.trends.service.dto.ClusterSource;
import com.demo.trends.service.dto.ClusterSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Cluster summaries over the image dataset, memoized per (n_clusters, sample_limit).
 * Falls back to synthetic summaries when the pipeline is missing ({@code mock}) or throws ({@code fallback_error}).
 */
@Slf4j
@Service
public class ClusterSummarizer {

    static final List<String> SYNTHETIC_LABELS = List.of("tops", "dresses", "shoes", "accessories");
    static final int SYNTHETIC_MIN_COUNT = 20;
    static final int SYNTHETIC_MAX_COUNT = 200;
    static final int SYNTHETIC_SAMPLES = 3;
    static final int SYNTHETIC_INDEX_BOUND = 1000;

    public static final int MAX_CLUSTERS = 100;
    public static final int MAX_SAMPLE_LIMIT = 10_000;

    private final ClusteringPipeline pipeline;
    private final ClusterCache cache;
    private final Random random;

    @Autowired
    public ClusterSummarizer(ClusteringPipeline pipeline) {
        this(pipeline, new ClusterCache(), new Random());
    }

    ClusterSummarizer(ClusteringPipeline pipeline, ClusterCache cache, Random random) {
        this.pipeline = pipeline;
        this.cache = cache;
        this.random = random;
    }

    public ClusterRun summarize(int nClusters, int sampleLimit) {
        if (nClusters <= 0 || nClusters > MAX_CLUSTERS) {
            throw new InvalidRequestException("n_clusters must be between 1 and " + MAX_CLUSTERS);
        }
        if (sampleLimit <= 0 || sampleLimit > MAX_SAMPLE_LIMIT) {
            throw new InvalidRequestException("sample_limit must be between 1 and " + MAX_SAMPLE_LIMIT);
        }
        return cache.getOrCompute(new ClusterCache.Key(nClusters, sampleLimit),
                () -> compute(nClusters, sampleLimit));
    }

    public boolean isPipelineAvailable() {
        return pipeline.isAvailable();
    }

    ClusterCache cache() {
        return cache;
    }

    private ClusterRun compute(int nClusters, int sampleLimit) {
        if (!pipeline.isAvailable()) {
            log.info("Clustering pipeline unavailable; synthesizing {} clusters", nClusters);
            return synthetic(nClusters, ClusterSource.MOCK);
        }
        try {
            ClusterAssignment a = pipeline.run(nClusters, sampleLimit);
            return new ClusterRun(toSummaries(a), ClusterSource.LIVE, a.sampled());
        } catch (Exception e) {
            log.warn("Clustering via {} failed, using synthetic clusters: {}", pipeline.name(), e.toString());
            return synthetic(nClusters, ClusterSource.FALLBACK_ERROR);
        }
    }

    static List<ClusterSummary> toSummaries(ClusterAssignment a) {
        int k = a.clusterCount();
        int[] counts = new int[k];
        List<List<Integer>> samples = new ArrayList<>(k);
        for (int c = 0; c < k; c++) samples.add(new ArrayList<>());

        int[] labels = a.labels();
        for (int i = 0; i < labels.length; i++) {
            int c = labels[i];
            counts[c]++;
            if (samples.get(c).size() < ClusterSummary.MAX_SAMPLE_REFS) {
                samples.get(c).add(a.originalIndices()[i]);
            }
        }

        List<ClusterSummary> out = new ArrayList<>(k);
        for (int c = 0; c < k; c++) {
            String hint = (a.labelHints() == null) ? null : a.labelHints()[c];
            out.add(new ClusterSummary(c, counts[c], samples.get(c), hint, norm(a.centroids()[c])));
        }
        return out;
    }

    private ClusterRun synthetic(int nClusters, ClusterSource source) {
        List<ClusterSummary> out = new ArrayList<>(nClusters);
        for (int c = 0; c < nClusters; c++) {
            int count = SYNTHETIC_MIN_COUNT + random.nextInt(SYNTHETIC_MAX_COUNT - SYNTHETIC_MIN_COUNT + 1);
            List<Integer> refs = new ArrayList<>(SYNTHETIC_SAMPLES);
            for (int s = 0; s < SYNTHETIC_SAMPLES; s++) refs.add(random.nextInt(SYNTHETIC_INDEX_BOUND));
            String label = SYNTHETIC_LABELS.get(random.nextInt(SYNTHETIC_LABELS.size()));
            out.add(new ClusterSummary(c, count, refs, label, null));
        }
        return new ClusterRun(out, source, null);
    }

    private static double norm(double[] v) {
        double s = 0.0;
        for (double x : v) s += x * x;
        return Math.sqrt(s);
    }
}
