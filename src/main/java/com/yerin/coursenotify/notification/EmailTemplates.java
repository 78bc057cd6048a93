package com.yerin.coursenotify.notification;

import com.yerin.coursenotify.config.NotifyScheduleProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Map;

@Component
public class EmailTemplates {
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final String SIGNATURE = "<p>Best regards,<br>Course Management System</p>";

    private final ZoneId zone;

    public EmailTemplates(NotifyScheduleProperties scheduleProperties) {
        this.zone = scheduleProperties.zoneId();
    }

    public RenderedEmail render(NotificationKind kind, List<Recipient> recipients, Map<String, Object> data) {
        return switch (kind) {
            case DEADLINE_REMINDER -> new RenderedEmail("Activity Log Deadline Reminder",
                    "<h2>Activity Log Deadline Reminder</h2>"
                            + "<p>Hello " + text(data, "firstName") + ",</p>"
                            + "<p>This is a friendly reminder that your activity log for <strong>"
                            + text(data, "courseName") + "</strong> (Week " + text(data, "weekNumber") + ") is due soon.</p>"
                            + "<p><strong>Due Date:</strong> " + date(data.get("dueDate")) + "</p>"
                            + "<p>Please log into the system to submit your weekly activities.</p>"
                            + SIGNATURE);
            case LATE_SUBMISSION_ALERT -> new RenderedEmail("Late Activity Log Submission Alert",
                    "<h2>Late Activity Log Submission Alert</h2>"
                            + "<p>This is an automated alert regarding a late activity log submission.</p>"
                            + "<p><strong>Facilitator:</strong> " + text(data, "facilitatorName")
                            + " (" + text(data, "facilitatorEmail") + ")</p>"
                            + "<p><strong>Course:</strong> " + text(data, "courseName") + "</p>"
                            + "<p><strong>Week Number:</strong> " + text(data, "weekNumber") + "</p>"
                            + "<p><strong>Due Date:</strong> " + date(data.get("dueDate")) + "</p>"
                            + "<p>The activity log for the above course has not been submitted by the deadline. "
                            + "Please follow up with the facilitator as needed.</p>"
                            + SIGNATURE);
            case COURSE_ASSIGNMENT -> new RenderedEmail("New Course Assignment",
                    "<h2>New Course Assignment</h2>"
                            + "<p>Hello " + text(data, "firstName") + ",</p>"
                            + "<p>You have been assigned to facilitate a new course:</p>"
                            + "<p><strong>Course:</strong> " + text(data, "courseName") + "</p>"
                            + "<p><strong>Cohort:</strong> " + text(data, "cohortName") + "</p>"
                            + "<p><strong>Start Date:</strong> " + date(data.get("startDate")) + "</p>"
                            + "<p>Please log into the system to view more details about your assignment.</p>"
                            + SIGNATURE);
            case WEEKLY_ACTIVITY_REMINDER -> new RenderedEmail("Weekly Activity Log Reminder",
                    "<h2>Weekly Activity Log Reminder</h2>"
                            + "<p>Hello " + text(data, "firstName") + ",</p>"
                            + "<p>This is your weekly reminder to submit activity logs for all your assigned courses.</p>"
                            + "<p>Please ensure that you log all activities for the current week by the deadline.</p>"
                            + "<p>Log into the system to submit your weekly activities.</p>"
                            + SIGNATURE);
        };
    }

    private static String text(Map<String, Object> data, String key) {
        Object v = data.get(key);
        return v == null ? "" : HtmlUtils.htmlEscape(String.valueOf(v));
    }

    private String date(Object value) {
        TemporalAccessor t;
        if (value instanceof Instant i) {
            t = i.atZone(zone);
        } else if (value instanceof LocalDate d) {
            t = d;
        } else {
            return value == null ? "" : HtmlUtils.htmlEscape(String.valueOf(value));
        }
        return DATE.format(t);
    }
}
