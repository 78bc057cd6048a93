package com.yerin.coursenotify.domain;

import java.time.Instant;

/**
 * Job state change published to the application event bus. Metrics and the audit log
 * subscribe to it; handlers never see it.
 */
public record JobLifecycleEvent(
        Long jobId,
        NotificationJobType type,
        Kind kind,
        String message,
        Instant at
) {
    public enum Kind {
        ENQUEUED,
        ACTIVE,
        COMPLETED,
        RETRY_SCHEDULED,
        FAILED,
        STALLED
    }

    public static JobLifecycleEvent of(NotificationJob job, Kind kind, String message, Instant at) {
        return new JobLifecycleEvent(job.getId(), job.getType(), kind, message, at);
    }
}
