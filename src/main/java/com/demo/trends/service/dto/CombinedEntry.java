package com.demo.trends.service.dto;

import java.util.List;

public record CombinedEntry(int clusterId, String category, double clusterPopScore,
                            double trendScore, double combinedScore, List<Integer> sampleRefs) {
}
