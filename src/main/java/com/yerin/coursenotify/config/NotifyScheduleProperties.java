package com.yerin.coursenotify.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Timing of the notifications relative to the activity due date.
 */
@ConfigurationProperties(prefix = "notify.schedule")
public record NotifyScheduleProperties(
        Duration reminderLeadTime,
        Duration lateGracePeriod,
        String weeklyCron,
        String zone,
        boolean weeklyBootstrap) {

    public NotifyScheduleProperties {
        if (reminderLeadTime == null) reminderLeadTime = Duration.ofHours(24);
        if (lateGracePeriod == null) lateGracePeriod = Duration.ofHours(1);
        if (weeklyCron == null || weeklyCron.isBlank()) weeklyCron = "0 10 * * 5";
        if (zone == null || zone.isBlank()) zone = "UTC";
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }
}
