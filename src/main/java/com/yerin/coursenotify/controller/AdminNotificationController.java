package com.yerin.coursenotify.controller;

import com.yerin.coursenotify.domain.JobHandle;
import com.yerin.coursenotify.domain.JobQueuePort;
import com.yerin.coursenotify.dto.response.QueueStatsResponse;
import com.yerin.coursenotify.global.dto.DataResponse;
import com.yerin.coursenotify.service.JobRetentionService;
import com.yerin.coursenotify.service.NotificationJobStore;
import com.yerin.coursenotify.service.NotificationScheduler;
import com.yerin.coursenotify.service.RetentionResult;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;

@RestController
@RequiredArgsConstructor
@RequestMapping("/admin/notifications")
public class AdminNotificationController {

    private final NotificationJobStore jobStore;
    private final JobRetentionService retentionService;
    private final NotificationScheduler scheduler;
    private final JobQueuePort queuePort;
    private final Clock clock;

    @GetMapping("/stats")
    public ResponseEntity<DataResponse<QueueStatsResponse>> stats(@RequestHeader(value = "X-Admin-Token", required = true)
                                                                  @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                                  String adminToken) {
        QueueStatsResponse body = QueueStatsResponse.of(jobStore.stats(), queuePort.backlog(), Instant.now(clock));
        return ResponseEntity.ok(DataResponse.from(body));
    }

    @PostMapping("/clean")
    public ResponseEntity<DataResponse<RetentionResult>> clean(@RequestHeader(value = "X-Admin-Token", required = true)
                                                               @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                               String adminToken) {
        return ResponseEntity.ok(DataResponse.from(retentionService.clean()));
    }

    @PostMapping("/weekly-reminders")
    public ResponseEntity<DataResponse<JobHandle>> weeklyReminders(@RequestHeader(value = "X-Admin-Token", required = true)
                                                                   @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                                   String adminToken) {
        return ResponseEntity.ok(DataResponse.from(scheduler.scheduleWeeklyReminders()));
    }
}
