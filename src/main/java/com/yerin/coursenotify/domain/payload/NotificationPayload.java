package com.yerin.coursenotify.domain.payload;

/**
 * Job payload. Carries identifiers and dates only; names and e-mail addresses are
 * looked up again when the job runs.
 */
public sealed interface NotificationPayload
        permits DeadlineReminderPayload, LateSubmissionAlertPayload,
                CourseAssignmentPayload, WeeklyActivityReminderPayload {
}
