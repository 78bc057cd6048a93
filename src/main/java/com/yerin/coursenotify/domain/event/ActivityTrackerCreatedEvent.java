package com.yerin.coursenotify.domain.event;

import com.yerin.coursenotify.domain.course.ActivityDeadline;

public record ActivityTrackerCreatedEvent(ActivityDeadline deadline) {}
