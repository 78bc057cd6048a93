package com.yerin.coursenotify.domain;

import java.time.Duration;

/**
 * Exponential backoff: the wait after the n-th failed attempt is {@code base * 2^(n-1)}.
 */
public record BackoffPolicy(long baseDelayMillis) {

    private static final int MAX_SHIFT = 30;

    public BackoffPolicy {
        if (baseDelayMillis < 0) {
            throw new IllegalArgumentException("baseDelayMillis must not be negative: " + baseDelayMillis);
        }
    }

    public static BackoffPolicy exponential(long baseDelayMillis) {
        return new BackoffPolicy(baseDelayMillis);
    }

    public Duration delayAfter(int attemptsMade) {
        int shift = Math.min(Math.max(0, attemptsMade - 1), MAX_SHIFT);
        return Duration.ofMillis(baseDelayMillis * (1L << shift));
    }
}
