package com.yerin.coursenotify.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notify.mail")
public record NotifyMailProperties(boolean enabled, String from) {
    public NotifyMailProperties {
        if (from == null || from.isBlank()) from = "no-reply@course-notify.local";
    }
}
