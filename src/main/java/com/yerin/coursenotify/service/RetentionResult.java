package com.yerin.coursenotify.service;

public record RetentionResult(int completedExpired, int completedTrimmed, int failedExpired) {
    public int total() {
        return completedExpired + completedTrimmed + failedExpired;
    }
}
