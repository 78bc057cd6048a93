package com.yerin.coursenotify.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.coursenotify.application.JobHandlerRegistry;
import com.yerin.coursenotify.domain.JobState;
import com.yerin.coursenotify.domain.NotificationJob;
import com.yerin.coursenotify.domain.NotificationJobType;
import com.yerin.coursenotify.domain.NotifyMetrics;
import com.yerin.coursenotify.domain.payload.DeadlineReminderPayload;
import com.yerin.coursenotify.service.NotificationJobProcessor.Outcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("워커 단건 처리 테스트")
public class NotificationJobProcessorTest {
    static final Instant DUE = Instant.parse("2026-03-06T17:00:00Z");
    static final String PAYLOAD = "{\"facilitatorId\":7,\"courseOfferingId\":3,\"weekNumber\":2,\"dueDate\":\"2026-03-06T17:00:00Z\"}";

    NotificationJobStore store = mock(NotificationJobStore.class);
    JobHandlerRegistry registry = mock(JobHandlerRegistry.class);
    SimpleMeterRegistry meters = new SimpleMeterRegistry();
    NotifyMetrics metrics = new NotifyMetrics(meters);
    ObjectMapper om = new ObjectMapper().findAndRegisterModules();

    NotificationJobProcessor sut = new NotificationJobProcessor(store, registry, om, metrics);

    @Test
    @DisplayName("모르는 타입 코드는 에러 없이 건너뛴다")
    void unknown_type_is_skipped() {
        Outcome out = sut.process(1L, "sms_blast");

        assertThat(out).isEqualTo(Outcome.SKIPPED);
        assertThat(meters.find("notify_jobs_skipped_total").counter().count()).isEqualTo(1.0);
        verifyNoInteractions(store, registry);
    }

    @Test
    @DisplayName("claim 실패 시 핸들러를 부르지 않는다")
    void not_claimed() {
        when(store.claim(1L)).thenReturn(Optional.empty());

        assertThat(sut.process(1L, "deadline_reminder")).isEqualTo(Outcome.NOT_CLAIMED);
        verifyNoInteractions(registry);
    }

    @Test
    @DisplayName("성공: 페이로드를 타입별 레코드로 복원해 핸들러 호출 후 완료")
    void success_completes() {
        when(store.claim(1L)).thenReturn(Optional.of(claimed(1)));

        assertThat(sut.process(1L, "deadline_reminder")).isEqualTo(Outcome.COMPLETED);

        verify(registry).dispatch(1L, NotificationJobType.DEADLINE_REMINDER,
                new DeadlineReminderPayload(7L, 3L, 2, DUE));
        verify(store).complete(1L, 1);
        verify(store, never()).failAttempt(any(), anyInt(), any());
        assertThat(meters.find("notify_handler_duration_seconds").tag("type", "deadline_reminder")
                .timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("핸들러 예외는 실패한 시도로 보고되고 재시도가 예약된다")
    void failure_schedules_retry() {
        when(store.claim(1L)).thenReturn(Optional.of(claimed(1)));
        doThrow(new IllegalStateException("smtp down")).when(registry).dispatch(any(), any(), any());
        when(store.failAttempt(eq(1L), eq(1), contains("smtp down"))).thenReturn(Optional.of(JobState.DELAYED));

        assertThat(sut.process(1L, "deadline_reminder")).isEqualTo(Outcome.RETRY_SCHEDULED);
        verify(store, never()).complete(any(), anyInt());
    }

    @Test
    @DisplayName("마지막 시도 실패는 FAILED")
    void last_failure_is_terminal() {
        when(store.claim(1L)).thenReturn(Optional.of(claimed(3)));
        doThrow(new IllegalStateException("smtp down")).when(registry).dispatch(any(), any(), any());
        when(store.failAttempt(eq(1L), eq(3), anyString())).thenReturn(Optional.of(JobState.FAILED));

        assertThat(sut.process(1L, "deadline_reminder")).isEqualTo(Outcome.FAILED);
    }

    @Test
    @DisplayName("페이로드를 읽을 수 없으면 실패한 시도")
    void unreadable_payload_fails_attempt() {
        NotificationJob job = claimed(1);
        job.setPayloadJson("{not json");
        when(store.claim(1L)).thenReturn(Optional.of(job));
        when(store.failAttempt(eq(1L), eq(1), anyString())).thenReturn(Optional.of(JobState.DELAYED));

        assertThat(sut.process(1L, "deadline_reminder")).isEqualTo(Outcome.RETRY_SCHEDULED);
        verifyNoInteractions(registry);
    }

    private static NotificationJob claimed(int attempt) {
        return NotificationJob.builder()
                .id(1L)
                .type(NotificationJobType.DEADLINE_REMINDER)
                .payloadJson(PAYLOAD)
                .state(JobState.ACTIVE)
                .attemptsMade(attempt)
                .maxAttempts(3)
                .backoffDelayMillis(2000)
                .runAt(Instant.parse("2026-03-05T17:00:00Z"))
                .build();
    }
}
