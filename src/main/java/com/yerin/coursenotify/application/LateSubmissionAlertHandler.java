package com.yerin.coursenotify.application;

import com.yerin.coursenotify.domain.NotificationJobType;
import com.yerin.coursenotify.domain.course.*;
import com.yerin.coursenotify.domain.payload.LateSubmissionAlertPayload;
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

/**
 * Marks an unsubmitted activity log as late and alerts every active manager.
 * <p>
 * The status read and the LATE write are not guarded against a submission arriving in
 * between; that race is accepted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LateSubmissionAlertHandler implements NotificationJobHandler<LateSubmissionAlertPayload> {

    private final CourseDataStore courseData;
    private final NotificationDispatcher dispatcher;

    @Override
    public NotificationJobType type() {
        return NotificationJobType.LATE_SUBMISSION_ALERT;
    }

    @Override
    public Class<LateSubmissionAlertPayload> payloadType() {
        return LateSubmissionAlertPayload.class;
    }

    @Override
    public void handle(Long jobId, LateSubmissionAlertPayload p) {
        Optional<ActivityTracker> submission =
                courseData.findSubmission(p.facilitatorId(), p.courseOfferingId(), p.weekNumber());
        if (submission.map(ActivityTracker::isSubmitted).orElse(false)) {
            log.info("[Handler.late_submission_alert] submitted in time, skip jobId={}, facilitatorId={}, week={}",
                    jobId, p.facilitatorId(), p.weekNumber());
            return;
        }
        submission.ifPresent(s -> courseData.updateSubmissionStatus(s.getId(), SubmissionStatus.LATE));

        AppUser facilitator = courseData.findUser(p.facilitatorId())
                .orElseThrow(() -> new AppException(NotificationErrorCode.FACILITATOR_NOT_FOUND
                        .withDetail("facilitatorId=" + p.facilitatorId())));
        CourseOffering offering = courseData.findCourseOffering(p.courseOfferingId(), true)
                .orElseThrow(() -> new AppException(NotificationErrorCode.COURSE_OFFERING_NOT_FOUND
                        .withDetail("courseOfferingId=" + p.courseOfferingId())));

        List<Recipient> managers = courseData.findUsersByRole(UserRole.MANAGER, true).stream()
                .map(Recipient::of)
                .toList();
        if (managers.isEmpty()) {
            log.warn("[Handler.late_submission_alert] no active managers, alert not sent jobId={}", jobId);
            return;
        }

        dispatcher.send(NotificationKind.LATE_SUBMISSION_ALERT, managers, Map.of(
                "facilitatorName", facilitator.fullName(),
                "facilitatorEmail", facilitator.getEmail(),
                "courseName", offering.getCourse().getName(),
                "weekNumber", p.weekNumber(),
                "dueDate", p.dueDate()
        ));
        log.info("[Handler.late_submission_alert] sent jobId={}, managers={}", jobId, managers.size());
    }
}
