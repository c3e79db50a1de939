package com.demo.trends.service.interest;

import java.util.List;

/** Source of keyword interest-over-time series. At most {@link #MAX_KEYWORDS} keywords per call. */
public interface InterestProvider {

    int MAX_KEYWORDS = 5;

    boolean isAvailable();

    String name();

    InterestSeries interestOverTime(List<String> keywords, String timeframe) throws Exception;
}
