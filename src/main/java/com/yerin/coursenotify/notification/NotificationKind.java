package com.yerin.coursenotify.notification;

public enum NotificationKind {
    DEADLINE_REMINDER,
    LATE_SUBMISSION_ALERT,
    COURSE_ASSIGNMENT,
    WEEKLY_ACTIVITY_REMINDER
}
