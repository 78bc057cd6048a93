package com.yerin.coursenotify.service;

import com.yerin.coursenotify.config.NotifyScheduleProperties;
import com.yerin.coursenotify.domain.JobHandle;
import com.yerin.coursenotify.domain.JobOptions;
import com.yerin.coursenotify.domain.NotificationJobType;
import com.yerin.coursenotify.domain.course.ActivityDeadline;
import com.yerin.coursenotify.domain.course.CourseAssignment;
import com.yerin.coursenotify.domain.payload.CourseAssignmentPayload;
import com.yerin.coursenotify.domain.payload.DeadlineReminderPayload;
import com.yerin.coursenotify.domain.payload.LateSubmissionAlertPayload;
import com.yerin.coursenotify.domain.payload.WeeklyActivityReminderPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Turns domain timing into queue directives. Sends nothing itself.
 * <p>
 * Store failures propagate to the caller; the caller's domain write is not rolled back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationScheduler {
    static final String WEEKLY_MESSAGE = "Weekly activity log reminder";

    private final NotificationJobStore jobStore;
    private final NotifyScheduleProperties properties;
    private final Clock clock;

    public Optional<JobHandle> scheduleDeadlineReminder(ActivityDeadline activity) {
        return scheduleDeadlineReminder(activity, null);
    }

    /**
     * @param reminderTime when to remind; {@code null} means the configured lead time before the due date
     * @return empty when the reminder time has already passed
     */
    public Optional<JobHandle> scheduleDeadlineReminder(ActivityDeadline activity, Instant reminderTime) {
        Instant fireAt = reminderTime != null
                ? reminderTime
                : activity.dueDate().minus(properties.reminderLeadTime());
        Duration delay = Duration.between(Instant.now(clock), fireAt);
        if (delay.isNegative() || delay.isZero()) {
            log.info("[Scheduler] reminder time passed, not scheduled facilitatorId={}, offeringId={}, week={}",
                    activity.facilitatorId(), activity.courseOfferingId(), activity.weekNumber());
            return Optional.empty();
        }

        JobHandle handle = jobStore.enqueue(NotificationJobType.DEADLINE_REMINDER,
                new DeadlineReminderPayload(activity.facilitatorId(), activity.courseOfferingId(),
                        activity.weekNumber(), activity.dueDate()),
                JobOptions.delayed(delay));
        log.info("[Scheduler] deadline reminder jobId={}, in {} ms", handle.id(), delay.toMillis());
        return Optional.of(handle);
    }

    public Optional<JobHandle> scheduleLateSubmissionAlert(ActivityDeadline activity) {
        Duration delay = Duration.between(Instant.now(clock), activity.dueDate()).plus(properties.lateGracePeriod());
        if (delay.isNegative() || delay.isZero()) {
            log.info("[Scheduler] late alert window passed, not scheduled facilitatorId={}, offeringId={}, week={}",
                    activity.facilitatorId(), activity.courseOfferingId(), activity.weekNumber());
            return Optional.empty();
        }

        JobHandle handle = jobStore.enqueue(NotificationJobType.LATE_SUBMISSION_ALERT,
                new LateSubmissionAlertPayload(activity.facilitatorId(), activity.courseOfferingId(),
                        activity.weekNumber(), activity.dueDate()),
                JobOptions.delayed(delay));
        log.info("[Scheduler] late alert jobId={}, in {} ms", handle.id(), delay.toMillis());
        return Optional.of(handle);
    }

    public JobHandle sendCourseAssignmentNotification(CourseAssignment assignment) {
        JobHandle handle = jobStore.enqueue(NotificationJobType.COURSE_ASSIGNMENT_NOTIFICATION,
                new CourseAssignmentPayload(assignment.facilitatorId(), assignment.courseOfferingId()),
                JobOptions.immediate());
        log.info("[Scheduler] course assignment jobId={}, facilitatorId={}", handle.id(), assignment.facilitatorId());
        return handle;
    }

    /**
     * Registers the weekly reminder recurrence. Calling it again returns the already
     * pending occurrence.
     */
    public JobHandle scheduleWeeklyReminders() {
        JobHandle handle;
        try {
            handle = registerWeekly();
        } catch (DataIntegrityViolationException e) {
            // 동시에 처음 등록한 다른 호출이 이겼다: 다시 부르면 그쪽 발생분을 돌려받는다
            log.info("[Scheduler] weekly registration raced, reading the winner's occurrence");
            handle = registerWeekly();
        }
        log.info("[Scheduler] weekly reminders cron='{}' zone={}, next jobId={} at {}",
                properties.weeklyCron(), properties.zone(), handle.id(), handle.runAt());
        return handle;
    }

    private JobHandle registerWeekly() {
        return jobStore.enqueue(NotificationJobType.WEEKLY_ACTIVITY_REMINDER,
                new WeeklyActivityReminderPayload(WEEKLY_MESSAGE),
                JobOptions.repeat(properties.weeklyCron(), properties.zoneId()));
    }
}
