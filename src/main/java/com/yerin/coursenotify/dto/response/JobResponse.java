package com.yerin.coursenotify.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.yerin.coursenotify.domain.JobState;
import com.yerin.coursenotify.domain.NotificationJob;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        Long id,
        String type,
        JobState state,
        Integer attemptsMade,
        Integer maxAttempts,
        Instant runAt,
        String cron,
        String lastError,
        Instant leaseUntil,
        Instant queuedAt,
        Instant createdAt,
        Instant updatedAt,
        Instant finishedAt
) {
    public static JobResponse from(NotificationJob j) {
        return new JobResponse(
                j.getId(),
                j.getType().getCode(),
                j.getState(),
                j.getAttemptsMade(),
                j.getMaxAttempts(),
                j.getRunAt(),
                j.getCronExpression(),
                j.getLastError(),
                j.getLeaseUntil(),
                j.getQueuedAt(),
                j.getCreatedAt(),
                j.getUpdatedAt(),
                j.getFinishedAt()
        );
    }
}
