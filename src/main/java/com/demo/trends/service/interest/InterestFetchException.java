package com.demo.trends.service.interest;

import lombok.Getter;

import java.util.List;

@Getter
public class InterestFetchException extends RuntimeException {

    private final int batchIndex;
    private final List<String> batch;

    public InterestFetchException(int batchIndex, List<String> batch, Throwable cause) {
        super("interest fetch failed for batch " + batchIndex + " " + batch + ": " + cause.getMessage(), cause);
        this.batchIndex = batchIndex;
        this.batch = List.copyOf(batch);
    }
}
