package com.yerin.coursenotify.domain;

public record QueueStats(
        long waiting,
        long active,
        long completed,
        long failed,
        long delayed
) {}
