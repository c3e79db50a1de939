package com.demo.trends.service;

import com.demo.trends.service.dto.ClusterSummary;
import com.demo.trends.service.dto.Combination;
import com.demo.trends.service.dto.CombinedEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SignalCombiner")
class SignalCombinerTest {

    private SignalCombiner combiner;

    @BeforeEach
    void setUp() {
        combiner = new SignalCombiner();
    }

    @Test
    @DisplayName("Single matching cluster: population 0, combined 0.6 * trend")
    void testCombine_SingleCluster() {
        Combination out = combiner.combine(Map.of("linen", 0.9), List.of(ClusterSummary.of(0, 10, "linen")));

        assertEquals(1, out.entries().size());
        CombinedEntry e = out.entries().get(0);
        assertEquals("linen", e.category());
        assertEquals(0.0, e.clusterPopScore());
        assertEquals(0.9, e.trendScore());
        assertEquals(0.54, e.combinedScore(), 1e-9);
        assertTrue(out.extraTrends().isEmpty());
    }

    @Test
    @DisplayName("Unmatched trend category becomes an extra trend with its score")
    void testCombine_ExtraTrend() {
        Map<String, Double> trends = new LinkedHashMap<>();
        trends.put("denim", 0.5);
        trends.put("linen", 0.9);

        Combination out = combiner.combine(trends, List.of(ClusterSummary.of(0, 10, "linen")));

        assertEquals(1, out.extraTrends().size());
        assertEquals("denim", out.extraTrends().get(0).category());
        assertEquals(0.5, out.extraTrends().get(0).trendScore());
    }

    @Test
    @DisplayName("Clusters without a label use cluster_<id> and default trend 0")
    void testCombine_UnlabelledCluster() {
        List<ClusterSummary> clusters = List.of(
                new ClusterSummary(0, 10, List.of(1, 2, 3, 4, 5), null, 1.2),
                new ClusterSummary(1, 30, List.of(9), " ", 0.4));

        Combination out = combiner.combine(Map.of("cluster_1", 0.5), clusters);

        CombinedEntry first = out.entries().get(0);
        CombinedEntry second = out.entries().get(1);
        assertEquals("cluster_0", first.category());
        assertEquals(0.0, first.trendScore());
        assertEquals(List.of(1, 2, 3), first.sampleRefs());
        assertEquals("cluster_1", second.category());
        assertEquals(1.0, second.clusterPopScore());
        assertEquals(0.6 * 0.5 + 0.4, second.combinedScore(), 1e-9);
        assertTrue(out.extraTrends().isEmpty());
    }

    @Test
    @DisplayName("Entries follow input cluster order and stay within [0,1]")
    void testCombine_OrderAndBounds() {
        List<ClusterSummary> clusters = List.of(
                ClusterSummary.of(2, 50, "shoes"),
                ClusterSummary.of(0, 20, "tops"),
                ClusterSummary.of(1, 80, "shoes"));

        Combination out = combiner.combine(Map.of("shoes", 1.0, "tops", 0.3), clusters);

        assertEquals(List.of(2, 0, 1), out.entries().stream().map(CombinedEntry::clusterId).toList());
        out.entries().forEach(e -> {
            assertTrue(e.combinedScore() >= 0.0 && e.combinedScore() <= 1.0);
            assertTrue(e.clusterPopScore() >= 0.0 && e.clusterPopScore() <= 1.0);
        });
        assertTrue(out.extraTrends().isEmpty());
    }
}
