package com.demo.trends.controller;

import com.demo.trends.service.clustering.ClusterSummarizer;
import com.demo.trends.service.interest.InterestFetcher;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class ServiceInfoController {

    static final String SERVICE_NAME = "trend-service";

    private final InterestFetcher fetcher;
    private final ClusterSummarizer summarizer;

    @GetMapping("/")
    public Map<String, Object> info() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("service", SERVICE_NAME);
        out.put("status", "running");
        out.put("endpoints", List.of("/api/trends", "/api/clusters", "/api/combined",
                "/api/mock-trends", "/api/demo-recommendation", "/health"));
        out.put("trend_provider_available", fetcher.isAvailable());
        out.put("cluster_pipeline_available", summarizer.isPipelineAvailable());
        return out;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy", "service", SERVICE_NAME);
    }
}
