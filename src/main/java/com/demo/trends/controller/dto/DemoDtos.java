package com.demo.trends.controller.dto;

import com.demo.trends.service.DemoRecommendationService.DemoProduct;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

public final class DemoDtos {
    private DemoDtos() {}

    public static class Product {
        public String id;
        public String title;
        public int price;
        @JsonProperty("size_recommendation")
        public String sizeRecommendation;
        @JsonProperty("size_confidence")
        public int sizeConfidence;
        @JsonProperty("return_risk_score")
        public double returnRiskScore;
        @JsonProperty("return_risk_label")
        public String returnRiskLabel;
        @JsonProperty("trend_category")
        public String trendCategory;
        @JsonProperty("trend_score")
        public double trendScore;

        static Product from(DemoProduct p) {
            Product o = new Product();
            o.id = p.id();
            o.title = p.title();
            o.price = p.price();
            o.sizeRecommendation = p.sizeRecommendation();
            o.sizeConfidence = p.sizeConfidence();
            o.returnRiskScore = p.returnRiskScore();
            o.returnRiskLabel = p.returnRiskLabel();
            o.trendCategory = p.trendCategory();
            o.trendScore = p.trendScore();
            return o;
        }
    }

    public static class RecommendationResponse {
        @JsonProperty("generated_at")
        public Instant generatedAt;
        public List<Product> products;

        public static RecommendationResponse of(List<DemoProduct> products) {
            RecommendationResponse r = new RecommendationResponse();
            r.generatedAt = Instant.now();
            r.products = products.stream().map(Product::from).collect(Collectors.toList());
            return r;
        }
    }
}
