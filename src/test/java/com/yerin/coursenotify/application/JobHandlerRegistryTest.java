package com.yerin.coursenotify.application;

import com.yerin.coursenotify.domain.NotificationJobType;
import com.yerin.coursenotify.domain.course.CourseDataStore;
import com.yerin.coursenotify.domain.payload.CourseAssignmentPayload;
import com.yerin.coursenotify.notification.NotificationDispatcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("핸들러 레지스트리 테스트")
public class JobHandlerRegistryTest {
    CourseDataStore data = mock(CourseDataStore.class);
    NotificationDispatcher dispatcher = mock(NotificationDispatcher.class);

    List<NotificationJobHandler<?>> all() {
        return new ArrayList<>(List.of(
                new DeadlineReminderHandler(data, dispatcher),
                new LateSubmissionAlertHandler(data, dispatcher),
                new CourseAssignmentHandler(data, dispatcher),
                new WeeklyActivityReminderHandler(data, dispatcher)));
    }

    @Test
    @DisplayName("모든 타입에 핸들러가 있어야 기동된다")
    void missing_handler_fails_fast() {
        var handlers = all();
        handlers.remove(3);

        assertThatThrownBy(() -> new JobHandlerRegistry(handlers))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("WEEKLY_ACTIVITY_REMINDER");
    }

    @Test
    @DisplayName("같은 타입 핸들러 중복 등록 거부")
    void duplicate_handler_rejected() {
        var handlers = all();
        handlers.add(new CourseAssignmentHandler(data, dispatcher));

        assertThatThrownBy(() -> new JobHandlerRegistry(handlers))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("잡 타입과 다른 페이로드를 받는 핸들러는 기동 시 거부")
    void payload_type_mismatch_rejected() {
        @SuppressWarnings("unchecked")
        NotificationJobHandler<CourseAssignmentPayload> wrong = mock(NotificationJobHandler.class);
        when(wrong.type()).thenReturn(NotificationJobType.DEADLINE_REMINDER);
        when(wrong.payloadType()).thenReturn(CourseAssignmentPayload.class);
        var handlers = all();
        handlers.set(0, wrong);

        assertThatThrownBy(() -> new JobHandlerRegistry(handlers))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("DeadlineReminderPayload");
    }

    @Test
    @DisplayName("타입에 맞는 핸들러로 전달")
    void dispatch_routes_by_type() {
        @SuppressWarnings("unchecked")
        NotificationJobHandler<CourseAssignmentPayload> assignment = mock(NotificationJobHandler.class);
        when(assignment.type()).thenReturn(NotificationJobType.COURSE_ASSIGNMENT_NOTIFICATION);
        when(assignment.payloadType()).thenReturn(CourseAssignmentPayload.class);
        var handlers = all();
        handlers.set(2, assignment);
        var sut = new JobHandlerRegistry(handlers);

        var payload = new CourseAssignmentPayload(7L, 3L);
        sut.dispatch(5L, NotificationJobType.COURSE_ASSIGNMENT_NOTIFICATION, payload);

        verify(assignment).handle(5L, payload);
        verifyNoInteractions(dispatcher, data);
    }
}
