package com.yerin.coursenotify.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Retry/backoff and retention policy applied to every notification job.
 */
@ConfigurationProperties(prefix = "notify.queue")
public record NotifyQueueProperties(
        int attempts,
        Duration backoffDelay,
        Duration lease,
        int completedKeep,
        Duration completedMaxAge,
        Duration failedMaxAge) {

    public NotifyQueueProperties {
        if (attempts <= 0) attempts = 3;
        if (backoffDelay == null) backoffDelay = Duration.ofMillis(2000);
        if (lease == null) lease = Duration.ofSeconds(30);
        if (completedKeep <= 0) completedKeep = 10;
        if (completedMaxAge == null) completedMaxAge = Duration.ofHours(24);
        if (failedMaxAge == null) failedMaxAge = Duration.ofDays(7);
    }

    public static NotifyQueueProperties defaults() {
        return new NotifyQueueProperties(0, null, null, 0, null, null);
    }
}
