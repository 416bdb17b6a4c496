package com.eventspotter.catalog.infrastructure.web;

public class RateLimitExceededException extends RuntimeException {

    public RateLimitExceededException() {
        super("Too many requests, please try again later.");
    }
}
