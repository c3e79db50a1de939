package com.demo.trends.controller.dto;

import com.demo.trends.service.CombinedTrendService.CombinedResult;
import com.demo.trends.service.ScoreNormalizer;
import com.demo.trends.service.dto.CombinedEntry;
import com.demo.trends.service.dto.ExtraTrend;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/** Combined ranking wire format; scores are rounded to 3 decimals here only. */
public final class CombinedDtos {
    private CombinedDtos() {}

    public static class CombinedItem {
        @JsonProperty("cluster_id")
        public int clusterId;
        public String category;
        @JsonProperty("cluster_pop_score")
        public double clusterPopScore;
        @JsonProperty("trend_score")
        public double trendScore;
        @JsonProperty("combined_score")
        public double combinedScore;
        @JsonProperty("sample_indices")
        public List<Integer> sampleIndices;

        static CombinedItem from(CombinedEntry e) {
            CombinedItem i = new CombinedItem();
            i.clusterId = e.clusterId();
            i.category = e.category();
            i.clusterPopScore = ScoreNormalizer.round(e.clusterPopScore(), 3);
            i.trendScore = ScoreNormalizer.round(e.trendScore(), 3);
            i.combinedScore = ScoreNormalizer.round(e.combinedScore(), 3);
            i.sampleIndices = e.sampleRefs();
            return i;
        }
    }

    public static class ExtraItem {
        public String category;
        @JsonProperty("trend_score")
        public double trendScore;

        static ExtraItem from(ExtraTrend t) {
            ExtraItem i = new ExtraItem();
            i.category = t.category();
            i.trendScore = ScoreNormalizer.round(t.trendScore(), 3);
            return i;
        }
    }

    public static class CombinedResponse {
        @JsonProperty("trend_source")
        public String trendSource;
        @JsonProperty("cluster_source")
        public String clusterSource;
        public List<CombinedItem> clusters;
        @JsonProperty("extra_trends")
        public List<ExtraItem> extraTrends;
        @JsonProperty("generated_at")
        public Instant generatedAt;

        public static CombinedResponse from(CombinedResult res) {
            CombinedResponse r = new CombinedResponse();
            r.trendSource = res.trends().source().wire();
            r.clusterSource = res.clusters().source().wire();
            r.clusters = res.combination().entries().stream()
                    .map(CombinedItem::from).collect(Collectors.toList());
            r.extraTrends = res.combination().extraTrends().stream()
                    .map(ExtraItem::from).collect(Collectors.toList());
            r.generatedAt = res.generatedAt();
            return r;
        }
    }
}
