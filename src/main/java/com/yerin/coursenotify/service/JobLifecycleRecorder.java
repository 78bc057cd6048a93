package com.yerin.coursenotify.service;

import com.yerin.coursenotify.domain.JobEventLog;
import com.yerin.coursenotify.domain.JobLifecycleEvent;
import com.yerin.coursenotify.domain.NotifyMetrics;
import com.yerin.coursenotify.repository.JobEventLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Subscribes to job lifecycle events: counts them and keeps an audit trail per job.
 */
@Component
@RequiredArgsConstructor
public class JobLifecycleRecorder {

    private final NotifyMetrics metrics;
    private final JobEventLogRepository eventLogRepository;

    @EventListener
    public void on(JobLifecycleEvent event) {
        switch (event.kind()) {
            case ENQUEUED -> metrics.incEnqueued();
            case COMPLETED -> metrics.incCompleted();
            case RETRY_SCHEDULED -> {
                metrics.incAttemptFailed();
                metrics.incRetried();
            }
            case FAILED -> {
                metrics.incAttemptFailed();
                metrics.incExhausted();
            }
            case STALLED -> metrics.incStalled();
            case ACTIVE -> { }
        }

        eventLogRepository.save(JobEventLog.of(event));
    }
}
