package com.yerin.coursenotify.domain;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Enqueue options: either a delay (zero for immediate) or a cron recurrence.
 */
public record JobOptions(Duration delay, String cron, ZoneId zone) {

    public static JobOptions immediate() {
        return new JobOptions(Duration.ZERO, null, null);
    }

    public static JobOptions delayed(Duration delay) {
        return new JobOptions(delay, null, null);
    }

    public static JobOptions repeat(String cron, ZoneId zone) {
        return new JobOptions(null, cron, zone);
    }

    public boolean isRecurring() {
        return cron != null;
    }

    public Duration effectiveDelay() {
        if (delay == null || delay.isNegative()) return Duration.ZERO;
        return delay;
    }
}
