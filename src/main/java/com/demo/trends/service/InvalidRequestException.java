package com.demo.trends.service;

/** Malformed caller input. The only error the engine surfaces to callers. */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
