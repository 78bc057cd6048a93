package com.yerin.coursenotify.domain.course;

public enum SubmissionStatus {
    PENDING,
    SUBMITTED,
    LATE,
    MISSED
}
