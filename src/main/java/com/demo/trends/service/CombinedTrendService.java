package com.demo.trends.service;

import com.demo.trends.service.clustering.ClusterSummarizer;
import com.demo.trends.service.dto.ClusterRun;
import com.demo.trends.service.dto.Combination;
import com.demo.trends.service.dto.TrendScores;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class CombinedTrendService {

    private final TrendService trendService;
    private final ClusterSummarizer clusterSummarizer;
    private final SignalCombiner combiner;
    private final CuratedTrendsCatalog curated;

    /**
     * @param keywords null to use the curated catalog; an empty list is rejected
     */
    public CombinedResult combined(List<String> keywords, int nClusters, int sampleLimit) {
        TrendScores trends;
        if (keywords == null) {
            trends = TrendScores.curated(curated.scores());
        } else {
            trends = trendService.trends(keywords, null);
        }
        ClusterRun clusters = clusterSummarizer.summarize(nClusters, sampleLimit);
        Combination combination = combiner.combine(trends.scores(), clusters.clusters());
        log.debug("Combined {} clusters ({}) with {} trend scores ({})",
                clusters.clusters().size(), clusters.source().wire(),
                trends.scores().size(), trends.source().wire());
        return new CombinedResult(trends, clusters, combination, Instant.now());
    }

    public record CombinedResult(TrendScores trends, ClusterRun clusters,
                                 Combination combination, Instant generatedAt) {}
}
