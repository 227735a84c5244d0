package com.tony.fantasyGolf.model.dto;

import java.time.Duration;

/**
 * @param retries   nombre de nouvelles tentatives après le premier échec
 * @param baseDelay délai avant la 1re nouvelle tentative, doublé à chaque échec
 */
public record RetryPolicy(int retries, Duration baseDelay) {

    public static final RetryPolicy NONE = new RetryPolicy(0, Duration.ZERO);

    public static RetryPolicy of(FreshnessDecision decision) {
        return new RetryPolicy(decision.retries(), decision.retryDelay());
    }

    public Duration delayFor(int attempt) {
        return baseDelay.multipliedBy(1L << Math.min(attempt, 16));
    }
}
