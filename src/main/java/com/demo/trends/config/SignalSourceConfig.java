package com.demo.trends.config;

import com.demo.trends.service.clustering.ClusteringPipeline;
import com.demo.trends.service.clustering.FashionMnistPipeline;
import com.demo.trends.service.clustering.IdxDatasetReader;
import com.demo.trends.service.clustering.UnavailableClusteringPipeline;
import com.demo.trends.service.interest.HttpInterestProvider;
import com.demo.trends.service.interest.InterestProvider;
import com.demo.trends.service.interest.UnconfiguredInterestProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Picks the live or unavailable implementation of each signal source from configuration.
 * trends.provider.type: http | none; clusters.pipeline.type: dataset | none.
 */
@Slf4j
@Configuration
public class SignalSourceConfig {

    @Bean
    public InterestProvider interestProvider(Environment env, RestTemplate restTemplate) {
        String type = env.getProperty("trends.provider.type", "none").toLowerCase(Locale.ROOT);
        String baseUrl = env.getProperty("trends.provider.base-url");
        if ("http".equals(type)) {
            if (!StringUtils.hasText(baseUrl)) {
                log.warn("trends.provider.type=http but trends.provider.base-url is empty; trends will be mocked");
                return new UnconfiguredInterestProvider();
            }
            log.info("Interest provider: {}", baseUrl);
            return new HttpInterestProvider(restTemplate, baseUrl);
        }
        log.info("Interest provider not configured (type={}); trends will be mocked", type);
        return new UnconfiguredInterestProvider();
    }

    @Bean
    public ClusteringPipeline clusteringPipeline(Environment env) {
        String type = env.getProperty("clusters.pipeline.type", "none").toLowerCase(Locale.ROOT);
        String images = env.getProperty("clusters.dataset.images-path");
        String labels = env.getProperty("clusters.dataset.labels-path");
        if ("dataset".equals(type) && StringUtils.hasText(images)) {
            log.info("Clustering pipeline: Fashion-MNIST at {}", images);
            return new FashionMnistPipeline(new IdxDatasetReader(), Path.of(images),
                    StringUtils.hasText(labels) ? Path.of(labels) : null);
        }
        log.info("Clustering pipeline not configured (type={}); clusters will be synthetic", type);
        return new UnavailableClusteringPipeline();
    }
}
