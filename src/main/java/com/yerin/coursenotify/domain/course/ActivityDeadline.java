package com.yerin.coursenotify.domain.course;

import java.time.Instant;
import java.util.Objects;

/**
 * The part of an activity tracker the scheduler needs to time its jobs.
 */
public record ActivityDeadline(
        Long facilitatorId,
        Long courseOfferingId,
        int weekNumber,
        Instant dueDate
) {
    public ActivityDeadline {
        Objects.requireNonNull(facilitatorId, "facilitatorId");
        Objects.requireNonNull(courseOfferingId, "courseOfferingId");
        Objects.requireNonNull(dueDate, "dueDate");
    }

    public static ActivityDeadline from(ActivityTracker tracker) {
        return new ActivityDeadline(tracker.getFacilitatorId(), tracker.getCourseOfferingId(),
                tracker.getWeekNumber(), tracker.getDueDate());
    }
}
