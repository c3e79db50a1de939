package com.demo.trends.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI trendOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Trend Signal Aggregator API")
                        .description("Keyword trends, image clusters and trend-aware cluster ranking. "
                                + "Responses carry a source tag (provider, mock, fallback_*) instead of failing "
                                + "when an upstream signal is unavailable.")
                        .version("v1"))
                .tags(List.of(
                        new Tag().name("trends").description("/api/trends, /api/mock-trends"),
                        new Tag().name("clusters").description("/api/clusters"),
                        new Tag().name("combined").description("/api/combined, /api/demo-recommendation")));
    }
}
