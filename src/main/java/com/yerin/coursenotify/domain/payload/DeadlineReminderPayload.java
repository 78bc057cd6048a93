package com.yerin.coursenotify.domain.payload;

import java.time.Instant;

public record DeadlineReminderPayload(
        Long facilitatorId,
        Long courseOfferingId,
        int weekNumber,
        Instant dueDate
) implements NotificationPayload {}
