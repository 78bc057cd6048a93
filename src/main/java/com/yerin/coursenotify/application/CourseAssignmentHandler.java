package com.yerin.coursenotify.application;

import com.yerin.coursenotify.domain.NotificationJobType;
import com.yerin.coursenotify.domain.course.AppUser;
import com.yerin.coursenotify.domain.course.CourseDataStore;
import com.yerin.coursenotify.domain.course.CourseOffering;
import com.yerin.coursenotify.domain.payload.CourseAssignmentPayload;
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

@Slf4j
@Component
@RequiredArgsConstructor
public class CourseAssignmentHandler implements NotificationJobHandler<CourseAssignmentPayload> {

    private final CourseDataStore courseData;
    private final NotificationDispatcher dispatcher;

    @Override
    public NotificationJobType type() {
        return NotificationJobType.COURSE_ASSIGNMENT_NOTIFICATION;
    }

    @Override
    public Class<CourseAssignmentPayload> payloadType() {
        return CourseAssignmentPayload.class;
    }

    @Override
    public void handle(Long jobId, CourseAssignmentPayload p) {
        AppUser facilitator = courseData.findUser(p.facilitatorId())
                .orElseThrow(() -> new AppException(NotificationErrorCode.FACILITATOR_NOT_FOUND
                        .withDetail("facilitatorId=" + p.facilitatorId())));
        // 과정명/코호트/시작일은 발송 시점 값으로 다시 읽는다
        CourseOffering offering = courseData.findCourseOffering(p.courseOfferingId(), true)
                .orElseThrow(() -> new AppException(NotificationErrorCode.COURSE_OFFERING_NOT_FOUND
                        .withDetail("courseOfferingId=" + p.courseOfferingId())));

        dispatcher.send(NotificationKind.COURSE_ASSIGNMENT, List.of(Recipient.of(facilitator)), Map.of(
                "firstName", facilitator.getFirstName(),
                "courseName", offering.getCourse().getName(),
                "cohortName", offering.getCohortName(),
                "startDate", offering.getStartDate()
        ));
        log.info("[Handler.course_assignment] sent jobId={}, to={}, offeringId={}",
                jobId, facilitator.getEmail(), offering.getId());
    }
}
