package com.demo.trends.service.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendSource {
    PROVIDER("provider"),
    MOCK("mock"),
    FALLBACK_PROVIDER_ERROR("fallback_provider_error"),
    CURATED("curated");

    private final String wire;

    TrendSource(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
