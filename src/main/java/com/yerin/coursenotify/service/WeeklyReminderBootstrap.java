package com.yerin.coursenotify.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notify.schedule.weekly-bootstrap", havingValue = "true")
public class WeeklyReminderBootstrap implements ApplicationRunner {

    private final NotificationScheduler scheduler;

    @Override
    public void run(ApplicationArguments args) {
        scheduler.scheduleWeeklyReminders();
    }
}
