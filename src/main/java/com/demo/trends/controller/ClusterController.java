package com.demo.trends.controller;

import com.demo.trends.controller.dto.ClusterDtos.ClustersResponse;
import com.demo.trends.service.clustering.ClusterSummarizer;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
@Validated
@RequiredArgsConstructor
public class ClusterController {

    private final ClusterSummarizer summarizer;

    @GetMapping("/clusters")
    public ClustersResponse clusters(
            @RequestParam(name = "n_clusters", defaultValue = "8") @Positive @Max(ClusterSummarizer.MAX_CLUSTERS) int nClusters,
            @RequestParam(name = "sample_limit", defaultValue = "5000") @Positive @Max(ClusterSummarizer.MAX_SAMPLE_LIMIT) int sampleLimit) {
        return ClustersResponse.from(nClusters, summarizer.summarize(nClusters, sampleLimit));
    }
}
