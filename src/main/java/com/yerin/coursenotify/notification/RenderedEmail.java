package com.yerin.coursenotify.notification;

public record RenderedEmail(String subject, String html) {}
