package com.demo.trends.service.interest;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Calls a Trends proxy: POST {base}/interest-over-time with {keywords, timeframe}.
 * Network errors, HTTP errors and timeouts propagate to the caller untouched.
 */
@Slf4j
public class HttpInterestProvider implements InterestProvider {

    private final RestTemplate rest;
    private final String base;

    public HttpInterestProvider(RestTemplate rest, String baseUrl) {
        this.rest = rest;
        this.base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String name() {
        return "http:" + base;
    }

    @Override
    public InterestSeries interestOverTime(List<String> keywords, String timeframe) {
        Map<String, Object> body = new HashMap<>();
        body.put("keywords", keywords);
        body.put("timeframe", timeframe);

        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_JSON);
        log.debug("Requesting interest for {} ({})", keywords, timeframe);
        ResponseEntity<InterestSeries> resp = rest.postForEntity(
                base + "/interest-over-time", new HttpEntity<>(body, h), InterestSeries.class);
        InterestSeries series = resp.getBody();
        return (series != null) ? series : new InterestSeries();
    }
}
