package com.demo.trends.service;

import com.demo.trends.service.dto.TrendScores;
import com.demo.trends.service.interest.InterestFetcher;
import com.demo.trends.service.interest.TrendFetch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Trend scores for a keyword set: live provider data when possible, deterministic mock scores otherwise.
 * Never fails because of the provider; only an empty keyword set is rejected.
 */
@Slf4j
@Service
public class TrendService {

    private final InterestFetcher fetcher;
    private final MockTrendGenerator mockGenerator;
    private final String defaultTimeframe;

    public TrendService(InterestFetcher fetcher, MockTrendGenerator mockGenerator,
                        @Value("${trends.default-timeframe:today 12-m}") String defaultTimeframe) {
        this.fetcher = fetcher;
        this.mockGenerator = mockGenerator;
        this.defaultTimeframe = defaultTimeframe;
    }

    public TrendScores trends(List<String> keywords, String timeframe) {
        if (keywords == null || keywords.isEmpty()) {
            throw new InvalidRequestException("no valid keywords provided");
        }
        String tf = (timeframe == null || timeframe.isBlank()) ? defaultTimeframe : timeframe;

        if (!fetcher.isAvailable()) {
            return TrendScores.mock(mockGenerator.mockScores(keywords));
        }

        TrendFetch outcome = fetcher.fetch(keywords, tf);
        if (outcome instanceof TrendFetch.Fetched fetched) {
            return TrendScores.provider(fetched.scores(), tf);
        }
        TrendFetch.FetchFailed failed = (TrendFetch.FetchFailed) outcome;
        log.warn("Falling back to mock trend scores: {}", failed.message());
        return TrendScores.fallback(mockGenerator.mockScores(keywords), failed.message());
    }

    /** "linen, denim,,linen" -> [linen, denim]. Null input stays null so callers can tell "absent" from "empty". */
    public static List<String> parseKeywords(String csv) {
        if (csv == null) return null;
        LinkedHashSet<String> kws = new LinkedHashSet<>();
        Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(kws::add);
        return new ArrayList<>(kws);
    }
}
