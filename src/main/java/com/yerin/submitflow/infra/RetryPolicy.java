package com.yerin.submitflow.infra;

import java.time.Duration;

/**
 * Retry budget for one directory task. {@code maxRetries} counts the attempts after the first one.
 * Delay before retry n (0-based) is {@code min(base * factor^n, cap)} scaled by {@code 1 ± jitter}.
 */
public record RetryPolicy(int maxRetries, Duration baseDelay, double factor, Duration maxDelay, double jitter) {

    public static final RetryPolicy DEFAULT =
            new RetryPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(60), 0.25);

    public RetryPolicy {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (factor < 1.0) throw new IllegalArgumentException("factor must be >= 1");
        if (jitter < 0 || jitter >= 1) throw new IllegalArgumentException("jitter must be in [0, 1)");
    }

    public Duration delayFor(int retryIndex) {
        return Backoff.expJitter(retryIndex, baseDelay.toMillis(), factor, maxDelay.toMillis(), jitter);
    }
}
