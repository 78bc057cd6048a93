package com.yerin.coursenotify.dto.response;

import com.yerin.coursenotify.domain.QueueStats;

import java.time.Instant;

public record QueueStatsResponse(
        long waiting,
        long active,
        long completed,
        long failed,
        long delayed,
        long streamBacklog,
        Instant ts
) {
    public static QueueStatsResponse of(QueueStats stats, long streamBacklog, Instant ts) {
        return new QueueStatsResponse(stats.waiting(), stats.active(), stats.completed(),
                stats.failed(), stats.delayed(), streamBacklog, ts);
    }
}
