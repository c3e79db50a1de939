package com.demo.trends.controller.dto;

import com.demo.trends.service.dto.CuratedTrend;
import com.demo.trends.service.dto.TrendScores;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public final class TrendDtos {
    private TrendDtos() {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class TrendsResponse {
        public String source;       // provider | mock | fallback_provider_error
        public String timeframe;    // only for provider data
        public String error;        // only for fallbacks
        public Map<String, Double> scores;

        public static TrendsResponse from(TrendScores t) {
            TrendsResponse r = new TrendsResponse();
            r.source = t.source().wire();
            r.timeframe = t.timeframe();
            r.error = t.error();
            r.scores = t.scores();
            return r;
        }
    }

    public static class CuratedItem {
        public String category;
        public double score;
        public String note;

        public static CuratedItem from(CuratedTrend t) {
            CuratedItem i = new CuratedItem();
            i.category = t.category();
            i.score = t.score();
            i.note = t.note();
            return i;
        }
    }

    public static class MockTrendsResponse {
        @JsonProperty("generated_at")
        public Instant generatedAt;
        public List<CuratedItem> trends;
    }
}
