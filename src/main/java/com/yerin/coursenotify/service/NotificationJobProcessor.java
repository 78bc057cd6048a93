package com.yerin.coursenotify.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.coursenotify.application.JobHandlerRegistry;
import com.yerin.coursenotify.domain.JobState;
import com.yerin.coursenotify.domain.NotificationJob;
import com.yerin.coursenotify.domain.NotificationJobType;
import com.yerin.coursenotify.domain.NotifyMetrics;
import com.yerin.coursenotify.domain.payload.NotificationPayload;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Runs one stream record: claim, decode, dispatch to the typed handler, then report the
 * outcome back to the job store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationJobProcessor {

    public enum Outcome {
        SKIPPED,
        NOT_CLAIMED,
        COMPLETED,
        RETRY_SCHEDULED,
        FAILED
    }

    private final NotificationJobStore jobStore;
    private final JobHandlerRegistry registry;
    private final ObjectMapper objectMapper;
    private final NotifyMetrics metrics;

    public Outcome process(Long jobId, String typeCode) {
        Optional<NotificationJobType> known = NotificationJobType.fromCode(typeCode);
        if (known.isEmpty()) {
            // 이 버전이 모르는 타입: 에러가 아니라 건너뛴다
            metrics.incSkipped();
            log.warn("[Worker] unknown job type={}, skip jobId={}", typeCode, jobId);
            return Outcome.SKIPPED;
        }

        Optional<NotificationJob> claimed = jobStore.claim(jobId);
        if (claimed.isEmpty()) {
            log.debug("[Worker] not claimable (taken or not due) jobId={}", jobId);
            return Outcome.NOT_CLAIMED;
        }
        NotificationJob job = claimed.get();
        NotificationJobType type = job.getType();
        int attempt = job.getAttemptsMade();

        Timer.Sample sample = Timer.start();
        try {
            NotificationPayload payload = objectMapper.readValue(job.getPayloadJson(), type.getPayloadType());
            registry.dispatch(jobId, type, payload);
            jobStore.complete(jobId, attempt);
            log.info("[Worker] completed jobId={}, type={}, attempt={}/{}",
                    jobId, type.getCode(), job.getAttemptsMade(), job.getMaxAttempts());
            return Outcome.COMPLETED;
        } catch (Exception e) {
            log.warn("[Worker] attempt failed jobId={}, type={}, attempt={}/{}, err={}",
                    jobId, type.getCode(), job.getAttemptsMade(), job.getMaxAttempts(), e.toString());
            return jobStore.failAttempt(jobId, attempt, e.toString())
                    .map(s -> s == JobState.FAILED ? Outcome.FAILED : Outcome.RETRY_SCHEDULED)
                    .orElse(Outcome.NOT_CLAIMED);
        } finally {
            sample.stop(metrics.handlerTimer(type.getCode()));
        }
    }
}
