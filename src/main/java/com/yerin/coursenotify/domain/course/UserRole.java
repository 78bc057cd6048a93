package com.yerin.coursenotify.domain.course;

public enum UserRole {
    MANAGER,
    FACILITATOR,
    STUDENT
}
