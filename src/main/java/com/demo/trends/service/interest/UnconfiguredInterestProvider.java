package com.demo.trends.service.interest;

import java.util.List;

public class UnconfiguredInterestProvider implements InterestProvider {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public String name() {
        return "none";
    }

    @Override
    public InterestSeries interestOverTime(List<String> keywords, String timeframe) {
        throw new IllegalStateException("interest provider not configured");
    }
}
