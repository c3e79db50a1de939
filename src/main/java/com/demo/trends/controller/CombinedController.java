package com.demo.trends.controller;

import com.demo.trends.controller.dto.CombinedDtos.CombinedResponse;
import com.demo.trends.controller.dto.DemoDtos.RecommendationResponse;
import com.demo.trends.service.CombinedTrendService;
import com.demo.trends.service.DemoRecommendationService;
import com.demo.trends.service.InvalidRequestException;
import com.demo.trends.service.TrendService;
import com.demo.trends.service.clustering.ClusterSummarizer;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
@Validated
@RequiredArgsConstructor
public class CombinedController {

    private final CombinedTrendService combined;
    private final DemoRecommendationService demo;

    /**
     * Clusters ranked by trend score and cluster population.
     * Without {@code keywords} the curated catalog supplies the trend side.
     */
    @GetMapping("/combined")
    public CombinedResponse combined(
            @RequestParam(required = false) String keywords,
            @RequestParam(name = "n_clusters", defaultValue = "8") @Positive @Max(ClusterSummarizer.MAX_CLUSTERS) int nClusters,
            @RequestParam(name = "sample_limit", defaultValue = "5000") @Positive @Max(ClusterSummarizer.MAX_SAMPLE_LIMIT) int sampleLimit) {
        List<String> kws = TrendService.parseKeywords(keywords);
        if (kws != null && kws.isEmpty()) {
            throw new InvalidRequestException("no valid keywords provided");
        }
        return CombinedResponse.from(combined.combined(kws, nClusters, sampleLimit));
    }

    @GetMapping("/demo-recommendation")
    public RecommendationResponse demoRecommendation(
            @RequestParam(required = false) String keywords,
            @RequestParam(defaultValue = "5") @Min(1) @Max(DemoRecommendationService.MAX_LIMIT) int limit) {
        return RecommendationResponse.of(demo.recommend(TrendService.parseKeywords(keywords), limit));
    }
}
