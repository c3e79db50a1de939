package com.demo.trends.service.interest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tabular interest series as returned by the provider:
 * {"timeline":[{"time":"2025-01-05","values":{"linen":52,"denim":null}}]}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InterestSeries {

    public List<Point> timeline = new ArrayList<>();

    public boolean isEmpty() {
        return timeline == null || timeline.isEmpty();
    }

    /** Mean of the keyword's samples, missing samples as 0. A keyword absent from every row scores 0. */
    public double mean(String keyword) {
        if (isEmpty()) return 0.0;
        boolean seen = false;
        double sum = 0.0;
        for (Point p : timeline) {
            Map<String, Double> vals = (p == null) ? null : p.values;
            if (vals != null && vals.containsKey(keyword)) {
                seen = true;
                Double v = vals.get(keyword);
                sum += (v == null || v.isNaN()) ? 0.0 : v;
            }
        }
        return seen ? sum / timeline.size() : 0.0;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Point {
        public String time;
        public Map<String, Double> values;
    }
}
