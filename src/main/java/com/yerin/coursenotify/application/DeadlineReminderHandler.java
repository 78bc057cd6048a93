package com.yerin.coursenotify.application;

import com.yerin.coursenotify.domain.NotificationJobType;
import com.yerin.coursenotify.domain.course.ActivityTracker;
import com.yerin.coursenotify.domain.course.AppUser;
import com.yerin.coursenotify.domain.course.CourseDataStore;
import com.yerin.coursenotify.domain.course.CourseOffering;
import com.yerin.coursenotify.domain.payload.DeadlineReminderPayload;
import com.yerin.coursenotify.global.exception.AppException;
import com.yerin.coursenotify.global.exception.code.NotificationErrorCode;
import com.yerin.coursenotify.notification.NotificationDispatcher;
import com.yerin.coursenotify.notification.NotificationKind;
import com.yerin.coursenotify.notification.Recipient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class DeadlineReminderHandler implements NotificationJobHandler<DeadlineReminderPayload> {

    private final CourseDataStore courseData;
    private final NotificationDispatcher dispatcher;

    @Override
    public NotificationJobType type() {
        return NotificationJobType.DEADLINE_REMINDER;
    }

    @Override
    public Class<DeadlineReminderPayload> payloadType() {
        return DeadlineReminderPayload.class;
    }

    @Override
    public void handle(Long jobId, DeadlineReminderPayload p) {
        Optional<ActivityTracker> submission =
                courseData.findSubmission(p.facilitatorId(), p.courseOfferingId(), p.weekNumber());
        if (submission.map(ActivityTracker::isSubmitted).orElse(false)) {
            log.info("[Handler.deadline_reminder] already submitted, skip jobId={}, facilitatorId={}, week={}",
                    jobId, p.facilitatorId(), p.weekNumber());
            return;
        }

        AppUser facilitator = courseData.findUser(p.facilitatorId())
                .orElseThrow(() -> new AppException(NotificationErrorCode.FACILITATOR_NOT_FOUND
                        .withDetail("facilitatorId=" + p.facilitatorId())));
        CourseOffering offering = courseData.findCourseOffering(p.courseOfferingId(), true)
                .orElseThrow(() -> new AppException(NotificationErrorCode.COURSE_OFFERING_NOT_FOUND
                        .withDetail("courseOfferingId=" + p.courseOfferingId())));

        dispatcher.send(NotificationKind.DEADLINE_REMINDER, List.of(Recipient.of(facilitator)), Map.of(
                "firstName", facilitator.getFirstName(),
                "courseName", offering.getCourse().getName(),
                "weekNumber", p.weekNumber(),
                "dueDate", p.dueDate()
        ));
        log.info("[Handler.deadline_reminder] sent jobId={}, to={}", jobId, facilitator.getEmail());
    }
}
