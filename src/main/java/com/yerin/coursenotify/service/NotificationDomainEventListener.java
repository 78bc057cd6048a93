package com.yerin.coursenotify.service;

import com.yerin.coursenotify.domain.event.ActivityTrackerCreatedEvent;
import com.yerin.coursenotify.domain.event.CourseOfferingAssignedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Schedules notifications once the domain write has committed. A scheduling failure is
 * logged and never reaches the publisher.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationDomainEventListener {

    private final NotificationScheduler scheduler;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onActivityTrackerCreated(ActivityTrackerCreatedEvent event) {
        var deadline = event.deadline();
        try {
            scheduler.scheduleDeadlineReminder(deadline);
        } catch (RuntimeException e) {
            log.warn("[Scheduler] deadline reminder not scheduled facilitatorId={}, offeringId={}, week={}",
                    deadline.facilitatorId(), deadline.courseOfferingId(), deadline.weekNumber(), e);
        }
        // 리마인더 예약이 실패해도 지각 알림은 따로 시도
        try {
            scheduler.scheduleLateSubmissionAlert(deadline);
        } catch (RuntimeException e) {
            log.warn("[Scheduler] late alert not scheduled facilitatorId={}, offeringId={}, week={}",
                    deadline.facilitatorId(), deadline.courseOfferingId(), deadline.weekNumber(), e);
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onCourseOfferingAssigned(CourseOfferingAssignedEvent event) {
        try {
            scheduler.sendCourseAssignmentNotification(event.assignment());
        } catch (RuntimeException e) {
            log.warn("[Scheduler] course assignment not scheduled facilitatorId={}, offeringId={}",
                    event.assignment().facilitatorId(), event.assignment().courseOfferingId(), e);
        }
    }
}
