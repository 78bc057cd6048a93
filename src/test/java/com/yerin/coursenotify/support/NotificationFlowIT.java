package com.yerin.coursenotify.support;

import com.yerin.coursenotify.domain.JobHandle;
import com.yerin.coursenotify.domain.JobOptions;
import com.yerin.coursenotify.domain.JobState;
import com.yerin.coursenotify.domain.NotificationJobType;
import com.yerin.coursenotify.domain.course.*;
import com.yerin.coursenotify.domain.event.CourseOfferingAssignedEvent;
import com.yerin.coursenotify.domain.payload.DeadlineReminderPayload;
import com.yerin.coursenotify.domain.payload.LateSubmissionAlertPayload;
import com.yerin.coursenotify.notification.NotificationKind;
import com.yerin.coursenotify.repository.ActivityTrackerRepository;
import com.yerin.coursenotify.service.NotificationJobStore;
import jakarta.persistence.EntityManager;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("E2E: enqueue → stream → worker → dispatcher")
class NotificationFlowIT extends IntegrationTestBase {

    @Autowired NotificationJobStore jobStore;
    @Autowired ActivityTrackerRepository trackerRepository;
    @Autowired RecordingDispatcherConfig.RecordingDispatcher dispatcher;
    @Autowired ApplicationEventPublisher events;
    @Autowired EntityManager em;
    @Autowired PlatformTransactionManager txManager;

    CourseDataSeeder seed;

    @BeforeEach
    void setUp() {
        seed = new CourseDataSeeder(em, new TransactionTemplate(txManager));
        dispatcher.clear();
    }

    @Test
    @DisplayName("미제출 활동의 지각 알림: 상태 LATE + 매니저 전원에게 1회 발송")
    void late_alert_marks_late_and_notifies_managers() {
        AppUser facilitator = seed.user("Alice", UserRole.FACILITATOR);
        seed.user("Bob", UserRole.MANAGER);
        CourseOffering offering = seed.offering(facilitator.getId());
        Instant due = Instant.now().minus(Duration.ofHours(2));
        ActivityTracker tracker = seed.tracker(facilitator.getId(), offering.getId(), 2, SubmissionStatus.PENDING, due);

        JobHandle h = jobStore.enqueue(NotificationJobType.LATE_SUBMISSION_ALERT,
                new LateSubmissionAlertPayload(facilitator.getId(), offering.getId(), 2, due),
                JobOptions.immediate());

        awaitState(h.id(), JobState.COMPLETED);

        assertThat(trackerRepository.findById(tracker.getId()).orElseThrow().getStatus())
                .isEqualTo(SubmissionStatus.LATE);
        var alerts = dispatcher.sent(NotificationKind.LATE_SUBMISSION_ALERT);
        assertThat(alerts).hasSize(1);
        assertThat(alerts.get(0).recipients()).isNotEmpty()
                .allSatisfy(r -> assertThat(r.email()).isNotEqualTo(facilitator.getEmail()));
    }

    @Test
    @DisplayName("제출 완료된 활동의 마감 리마인더는 발송 없이 완료")
    void submitted_reminder_completes_without_dispatch() {
        AppUser facilitator = seed.user("Carol", UserRole.FACILITATOR);
        CourseOffering offering = seed.offering(facilitator.getId());
        Instant due = Instant.now().plus(Duration.ofHours(20));
        seed.tracker(facilitator.getId(), offering.getId(), 3, SubmissionStatus.SUBMITTED, due);

        JobHandle h = jobStore.enqueue(NotificationJobType.DEADLINE_REMINDER,
                new DeadlineReminderPayload(facilitator.getId(), offering.getId(), 3, due),
                JobOptions.immediate());

        awaitState(h.id(), JobState.COMPLETED);
        assertThat(dispatcher.sent(NotificationKind.DEADLINE_REMINDER)).isEmpty();
    }

    @Test
    @DisplayName("코스 배정 이벤트 → 즉시 배정 알림")
    void offering_assigned_event_notifies_facilitator() {
        AppUser facilitator = seed.user("Dave", UserRole.FACILITATOR);
        CourseOffering offering = seed.offering(facilitator.getId());

        events.publishEvent(new CourseOfferingAssignedEvent(CourseAssignment.from(offering)));

        Awaitility.await()
                .atMost(Duration.ofSeconds(10))
                .pollInterval(Duration.ofMillis(200))
                .untilAsserted(() -> assertThat(dispatcher.sent(NotificationKind.COURSE_ASSIGNMENT))
                        .anySatisfy(s -> {
                            assertThat(s.recipients().get(0).email()).isEqualTo(facilitator.getEmail());
                            assertThat(s.data().get("cohortName")).isEqualTo("Cohort 2026");
                        }));
    }

    @Test
    @DisplayName("지연 작업은 실행 시각 전에는 DELAYED로 남는다")
    void delayed_job_waits() {
        JobHandle h = jobStore.enqueue(NotificationJobType.DEADLINE_REMINDER,
                new DeadlineReminderPayload(1L, 1L, 1, Instant.now().plus(Duration.ofDays(2))),
                JobOptions.delayed(Duration.ofHours(1)));

        assertThat(h.state()).isEqualTo(JobState.DELAYED);
        Awaitility.await().pollDelay(Duration.ofSeconds(1)).atMost(Duration.ofSeconds(2))
                .untilAsserted(() -> assertThat(jobStore.find(h.id()).orElseThrow().getState())
                        .isEqualTo(JobState.DELAYED));
    }

    private void awaitState(Long jobId, JobState expected) {
        Awaitility.await()
                .atMost(Duration.ofSeconds(10))
                .pollInterval(Duration.ofMillis(200))
                .untilAsserted(() -> assertThat(jobStore.find(jobId).orElseThrow().getState()).isEqualTo(expected));
    }
}
