package com.yerin.coursenotify.application;

import com.yerin.coursenotify.domain.course.AppUser;
import com.yerin.coursenotify.domain.course.CourseDataStore;
import com.yerin.coursenotify.domain.course.SubmissionStatus;
import com.yerin.coursenotify.domain.course.UserRole;
import com.yerin.coursenotify.domain.payload.LateSubmissionAlertPayload;
import com.yerin.coursenotify.global.exception.AppException;
import com.yerin.coursenotify.notification.NotificationDispatcher;
import com.yerin.coursenotify.notification.NotificationKind;
import com.yerin.coursenotify.notification.Recipient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.yerin.coursenotify.application.CourseFixtures.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("지각 제출 알림 핸들러 테스트")
public class LateSubmissionAlertHandlerTest {
    static final Instant DUE = Instant.now().minus(Duration.ofHours(2));

    CourseDataStore data = mock(CourseDataStore.class);
    NotificationDispatcher dispatcher = mock(NotificationDispatcher.class);
    LateSubmissionAlertHandler sut = new LateSubmissionAlertHandler(data, dispatcher);

    LateSubmissionAlertPayload payload = new LateSubmissionAlertPayload(7L, 3L, 2, DUE);

    @Test
    @DisplayName("미제출(PENDING), 마감 2시간 경과 → LATE로 변경 + 활성 매니저 전원에게 1회 발송")
    void pending_becomes_late_and_managers_alerted() {
        var facilitator = user(7L, "Alice", UserRole.FACILITATOR);
        List<AppUser> managers = List.of(user(1L, "Bob", UserRole.MANAGER), user(2L, "Carol", UserRole.MANAGER));
        when(data.findSubmission(7L, 3L, 2)).thenReturn(Optional.of(tracker(11L, SubmissionStatus.PENDING, DUE)));
        when(data.findUser(7L)).thenReturn(Optional.of(facilitator));
        when(data.findCourseOffering(3L, true)).thenReturn(Optional.of(offering(3L, 7L)));
        when(data.findUsersByRole(UserRole.MANAGER, true)).thenReturn(managers);

        sut.handle(1L, payload);

        verify(data).updateSubmissionStatus(11L, SubmissionStatus.LATE);
        verify(dispatcher, times(1)).send(eq(NotificationKind.LATE_SUBMISSION_ALERT),
                eq(managers.stream().map(Recipient::of).toList()),
                argThat(m -> "Alice Kim".equals(m.get("facilitatorName"))
                        && "alice@example.com".equals(m.get("facilitatorEmail"))));
    }

    @Test
    @DisplayName("제출 완료면 상태 변경/발송 모두 없음")
    void submitted_is_noop() {
        when(data.findSubmission(7L, 3L, 2)).thenReturn(Optional.of(tracker(11L, SubmissionStatus.SUBMITTED, DUE)));

        sut.handle(1L, payload);

        verify(data, never()).updateSubmissionStatus(any(), any());
        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("기록이 없으면 상태 변경 없이 알림만")
    void no_record_alerts_without_status_change() {
        when(data.findSubmission(7L, 3L, 2)).thenReturn(Optional.empty());
        when(data.findUser(7L)).thenReturn(Optional.of(user(7L, "Alice", UserRole.FACILITATOR)));
        when(data.findCourseOffering(3L, true)).thenReturn(Optional.of(offering(3L, 7L)));
        when(data.findUsersByRole(UserRole.MANAGER, true)).thenReturn(List.of(user(1L, "Bob", UserRole.MANAGER)));

        sut.handle(1L, payload);

        verify(data, never()).updateSubmissionStatus(any(), any());
        verify(dispatcher).send(eq(NotificationKind.LATE_SUBMISSION_ALERT), anyList(), anyMap());
    }

    @Test
    @DisplayName("활성 매니저가 없으면 발송 생략 (에러 아님)")
    void no_managers_skips_dispatch() {
        when(data.findSubmission(7L, 3L, 2)).thenReturn(Optional.of(tracker(11L, SubmissionStatus.PENDING, DUE)));
        when(data.findUser(7L)).thenReturn(Optional.of(user(7L, "Alice", UserRole.FACILITATOR)));
        when(data.findCourseOffering(3L, true)).thenReturn(Optional.of(offering(3L, 7L)));
        when(data.findUsersByRole(UserRole.MANAGER, true)).thenReturn(List.of());

        assertThatCode(() -> sut.handle(1L, payload)).doesNotThrowAnyException();

        verify(data).updateSubmissionStatus(11L, SubmissionStatus.LATE);
        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("퍼실리테이터가 없으면 예외")
    void missing_facilitator_throws() {
        when(data.findSubmission(7L, 3L, 2)).thenReturn(Optional.empty());
        when(data.findUser(7L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> sut.handle(1L, payload)).isInstanceOf(AppException.class);
        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("발송 실패는 그대로 전파")
    void dispatch_failure_propagates() {
        when(data.findSubmission(7L, 3L, 2)).thenReturn(Optional.empty());
        when(data.findUser(7L)).thenReturn(Optional.of(user(7L, "Alice", UserRole.FACILITATOR)));
        when(data.findCourseOffering(3L, true)).thenReturn(Optional.of(offering(3L, 7L)));
        when(data.findUsersByRole(UserRole.MANAGER, true)).thenReturn(List.of(user(1L, "Bob", UserRole.MANAGER)));
        doThrow(new IllegalStateException("smtp down")).when(dispatcher).send(any(), anyList(), anyMap());

        assertThatThrownBy(() -> sut.handle(1L, payload)).hasMessageContaining("smtp down");
    }
}
