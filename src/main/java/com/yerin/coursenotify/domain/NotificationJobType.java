package com.yerin.coursenotify.domain;

import com.yerin.coursenotify.domain.payload.CourseAssignmentPayload;
import com.yerin.coursenotify.domain.payload.DeadlineReminderPayload;
import com.yerin.coursenotify.domain.payload.LateSubmissionAlertPayload;
import com.yerin.coursenotify.domain.payload.NotificationPayload;
import com.yerin.coursenotify.domain.payload.WeeklyActivityReminderPayload;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum NotificationJobType {
    DEADLINE_REMINDER("deadline_reminder", DeadlineReminderPayload.class),
    LATE_SUBMISSION_ALERT("late_submission_alert", LateSubmissionAlertPayload.class),
    COURSE_ASSIGNMENT_NOTIFICATION("course_assignment_notification", CourseAssignmentPayload.class),
    WEEKLY_ACTIVITY_REMINDER("weekly_activity_reminder", WeeklyActivityReminderPayload.class);

    private final String code;
    private final Class<? extends NotificationPayload> payloadType;

    /**
     * 스트림에 실린 타입 코드를 해석한다. 이 버전이 모르는 코드면 비어 있는 값을 돌려준다.
     */
    public static Optional<NotificationJobType> fromCode(String code) {
        if (code == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(t -> t.code.equals(code))
                .findFirst();
    }
}
