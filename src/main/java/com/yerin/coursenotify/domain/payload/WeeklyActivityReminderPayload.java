package com.yerin.coursenotify.domain.payload;

public record WeeklyActivityReminderPayload(String message) implements NotificationPayload {}
