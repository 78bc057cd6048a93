package com.yerin.coursenotify.domain;

import java.time.Instant;

public record JobHandle(
        Long id,
        NotificationJobType type,
        JobState state,
        Instant runAt
) {
    public static JobHandle from(NotificationJob job) {
        return new JobHandle(job.getId(), job.getType(), job.getState(), job.getRunAt());
    }
}
