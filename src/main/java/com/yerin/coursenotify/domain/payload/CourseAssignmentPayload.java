package com.yerin.coursenotify.domain.payload;

public record CourseAssignmentPayload(
        Long facilitatorId,
        Long courseOfferingId
) implements NotificationPayload {}
