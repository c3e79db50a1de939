package com.demo.trends.service.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/** Provenance of a cluster summary set. */
public enum ClusterSource {
    LIVE("live"),
    MOCK("mock"),
    FALLBACK_ERROR("fallback_error");

    private final String wire;

    ClusterSource(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
