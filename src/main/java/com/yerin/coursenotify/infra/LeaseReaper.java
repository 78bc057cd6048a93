package com.yerin.coursenotify.infra;

import com.yerin.coursenotify.domain.JobState;
import com.yerin.coursenotify.domain.NotificationJob;
import com.yerin.coursenotify.repository.NotificationJobRepository;
import com.yerin.coursenotify.service.NotificationJobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class LeaseReaper {

    private final NotificationJobRepository jobRepository;
    private final NotificationJobStore jobStore;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${notify.reaper.intervalMillis:5000}")
    public int reap() {
        Instant now = Instant.now(clock);

        List<NotificationJob> expired = jobRepository
                .findTop100ByStateAndLeaseUntilLessThanEqualOrderByLeaseUntilAsc(JobState.ACTIVE, now);

        if (expired.isEmpty()) return 0;

        int handled = 0;
        for (NotificationJob j : expired) {
            try {
                jobStore.reclaimStalled(j.getId());
                handled++;
            } catch (Exception e) {
                log.warn("[LeaseReaper] failed to reclaim jobId={}, err={}", j.getId(), e.toString());
            }
        }
        log.info("[LeaseReaper] reaped={} (stalled ACTIVE jobs)", handled);
        return handled;
    }
}
