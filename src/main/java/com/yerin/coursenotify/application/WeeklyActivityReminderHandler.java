package com.yerin.coursenotify.application;

import com.yerin.coursenotify.domain.NotificationJobType;
import com.yerin.coursenotify.domain.course.AppUser;
import com.yerin.coursenotify.domain.course.CourseDataStore;
import com.yerin.coursenotify.domain.course.UserRole;
import com.yerin.coursenotify.domain.payload.WeeklyActivityReminderPayload;
import com.yerin.coursenotify.notification.NotificationDispatcher;
import com.yerin.coursenotify.notification.NotificationKind;
import com.yerin.coursenotify.notification.Recipient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Best effort per recipient: one failed send is logged and the batch continues.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WeeklyActivityReminderHandler implements NotificationJobHandler<WeeklyActivityReminderPayload> {

    private final CourseDataStore courseData;
    private final NotificationDispatcher dispatcher;

    @Override
    public NotificationJobType type() {
        return NotificationJobType.WEEKLY_ACTIVITY_REMINDER;
    }

    @Override
    public Class<WeeklyActivityReminderPayload> payloadType() {
        return WeeklyActivityReminderPayload.class;
    }

    @Override
    public void handle(Long jobId, WeeklyActivityReminderPayload p) {
        List<AppUser> facilitators = courseData.findUsersByRole(UserRole.FACILITATOR, true);
        if (facilitators.isEmpty()) {
            log.info("[Handler.weekly_reminder] no active facilitators, nothing to send jobId={}", jobId);
            return;
        }

        int sent = 0;
        for (AppUser f : facilitators) {
            try {
                dispatcher.send(NotificationKind.WEEKLY_ACTIVITY_REMINDER, List.of(Recipient.of(f)), Map.of(
                        "firstName", f.getFirstName(),
                        "message", p.message() == null ? "" : p.message()
                ));
                sent++;
            } catch (RuntimeException e) {
                log.warn("[Handler.weekly_reminder] send failed jobId={}, to={}, err={}",
                        jobId, f.getEmail(), e.toString());
            }
        }
        log.info("[Handler.weekly_reminder] done jobId={}, sent={}/{}", jobId, sent, facilitators.size());
    }
}
