package com.yerin.coursenotify.controller;

import com.yerin.coursenotify.domain.NotificationJob;
import com.yerin.coursenotify.dto.response.JobResponse;
import com.yerin.coursenotify.global.dto.DataResponse;
import com.yerin.coursenotify.global.exception.AppException;
import com.yerin.coursenotify.global.exception.code.JobErrorCode;
import com.yerin.coursenotify.service.NotificationJobStore;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/admin/notifications/jobs")
public class AdminJobController {
    private final NotificationJobStore jobStore;

    @GetMapping("/{id}")
    public ResponseEntity<DataResponse<JobResponse>> get(@PathVariable Long id,
                                                         @RequestHeader(value = "X-Admin-Token", required = true)
                                                         @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                         String adminToken) {
        NotificationJob job = jobStore.find(id)
                .orElseThrow(() -> new AppException(JobErrorCode.JOB_NOT_FOUND));
        return ResponseEntity.ok(DataResponse.from(JobResponse.from(job)));
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<DataResponse<JobResponse>> retry(@PathVariable Long id,
                                                           @RequestHeader(value = "X-Admin-Token", required = true)
                                                           @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                           String adminToken) {
        NotificationJob job = jobStore.retry(id);
        return ResponseEntity.ok(DataResponse.from(JobResponse.from(job)));
    }
}
