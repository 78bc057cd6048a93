package com.yerin.coursenotify.infra;

import com.yerin.coursenotify.service.JobRetentionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class JobRetentionWorker {

    private final JobRetentionService retentionService;

    @Scheduled(fixedDelayString = "${notify.retention.intervalMillis:600000}",
            initialDelayString = "${notify.retention.initialDelayMillis:60000}")
    public void run() {
        try {
            retentionService.clean();
        } catch (Exception e) {
            log.warn("[Retention] cleanup failed, will retry next round: {}", e.toString());
        }
    }
}
