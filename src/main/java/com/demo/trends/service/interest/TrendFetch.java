package com.demo.trends.service.interest;

import java.util.Map;

/** Outcome of one live interest fetch. */
public sealed interface TrendFetch permits TrendFetch.Fetched, TrendFetch.FetchFailed {

    record Fetched(Map<String, Double> scores) implements TrendFetch {}

    record FetchFailed(InterestFetchException error) implements TrendFetch {
        public String message() {
            return error.getMessage();
        }
    }
}
