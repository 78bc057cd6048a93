package com.yerin.coursenotify.domain.payload;

import java.time.Instant;

public record LateSubmissionAlertPayload(
        Long facilitatorId,
        Long courseOfferingId,
        int weekNumber,
        Instant dueDate
) implements NotificationPayload {}
