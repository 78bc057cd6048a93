package com.yerin.coursenotify.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.coursenotify.config.NotifyQueueProperties;
import com.yerin.coursenotify.domain.*;
import com.yerin.coursenotify.domain.payload.NotificationPayload;
import com.yerin.coursenotify.global.exception.AppException;
import com.yerin.coursenotify.global.exception.code.JobErrorCode;
import com.yerin.coursenotify.infra.CronSchedule;
import com.yerin.coursenotify.repository.NotificationJobRepository;
import com.yerin.coursenotify.repository.RepeatableJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Persistent delay queue for notification jobs.
 * <p>
 * Every state transition is a conditional update on the current state, so a job can be
 * active in at most one worker and late updates from a reclaimed attempt are ignored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationJobStore {
    private static final int MAX_ERROR_LENGTH = 2000;

    private final NotificationJobRepository jobRepository;
    private final RepeatableJobRepository repeatableJobRepository;
    private final NotifyQueueProperties properties;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    // 항상 독립 트랜잭션: 실패해도 호출자 트랜잭션은 rollback-only가 되지 않는다
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public JobHandle enqueue(NotificationJobType type, NotificationPayload payload, JobOptions options) {
        if (!type.getPayloadType().isInstance(payload)) {
            throw new AppException(JobErrorCode.PAYLOAD_TYPE_MISMATCH.withDetail(
                    "type=" + type.getCode() + ", payload=" + payload.getClass().getSimpleName()));
        }
        String payloadJson = write(payload);
        Instant now = Instant.now(clock);

        if (options.isRecurring()) {
            return enqueueRepeatable(type, payloadJson, options, now);
        }

        Duration delay = options.effectiveDelay();
        NotificationJob job = jobRepository.save(newJob(type, payloadJson, now.plus(delay),
                delay.isZero() ? JobState.WAITING : JobState.DELAYED));

        events.publishEvent(JobLifecycleEvent.of(job, JobLifecycleEvent.Kind.ENQUEUED, null, now));
        log.info("[JobStore] enqueued jobId={}, type={}, state={}, runAt={}",
                job.getId(), type.getCode(), job.getState(), job.getRunAt());
        return JobHandle.from(job);
    }

    private JobHandle enqueueRepeatable(NotificationJobType type, String payloadJson, JobOptions options, Instant now) {
        ZoneId zone = options.zone() == null ? ZoneOffset.UTC : options.zone();
        try {
            CronSchedule.validate(options.cron());
        } catch (IllegalArgumentException e) {
            throw new AppException(JobErrorCode.INVALID_CRON.withDetail("cron=" + options.cron()), e);
        }
        String repeatKey = RepeatableJob.keyOf(type, options.cron(), zone.getId());

        if (repeatableJobRepository.findByRepeatKey(repeatKey).isPresent()) {
            Optional<NotificationJob> pending = jobRepository
                    .findFirstByRepeatKeyAndStateInOrderByRunAtAsc(repeatKey, JobState.PENDING);
            if (pending.isPresent()) {
                log.info("[JobStore] repeatable already registered key={}, next jobId={}",
                        repeatKey, pending.get().getId());
                return JobHandle.from(pending.get());
            }
        } else {
            repeatableJobRepository.save(RepeatableJob.builder()
                    .repeatKey(repeatKey)
                    .type(type)
                    .cronExpression(options.cron())
                    .zoneId(zone.getId())
                    .payloadJson(payloadJson)
                    .createdAt(now)
                    .build());
            log.info("[JobStore] repeatable registered key={}", repeatKey);
        }

        NotificationJob occurrence = saveOccurrence(type, payloadJson, options.cron(), zone, repeatKey, now);
        return JobHandle.from(occurrence);
    }

    /**
     * Moves a due job to ACTIVE and counts the attempt. Empty if another worker got it
     * first or the job is not due.
     */
    @Transactional
    public Optional<NotificationJob> claim(Long jobId) {
        Instant now = Instant.now(clock);
        int grabbed = jobRepository.claimIfDue(jobId, now, now.plus(properties.lease()));
        if (grabbed == 0) {
            return Optional.empty();
        }
        NotificationJob job = jobRepository.findById(jobId)
                .orElseThrow(() -> new AppException(JobErrorCode.JOB_NOT_FOUND));

        if (job.isRecurring()) {
            scheduleNextOccurrence(job, now);
        }
        events.publishEvent(JobLifecycleEvent.of(job, JobLifecycleEvent.Kind.ACTIVE,
                "attempt " + job.getAttemptsMade() + "/" + job.getMaxAttempts(), now));
        return Optional.of(job);
    }

    /**
     * Completes the given attempt. Ignored when the job has since been reclaimed or moved on.
     */
    @Transactional
    public void complete(Long jobId, int attempt) {
        Instant now = Instant.now(clock);
        int updated = jobRepository.completeIfActive(jobId, attempt, now);
        if (updated == 0) {
            log.warn("[JobStore] complete lost race jobId={}, attempt={} (no longer ACTIVE for this attempt)",
                    jobId, attempt);
            return;
        }
        jobRepository.findById(jobId).ifPresent(job ->
                events.publishEvent(JobLifecycleEvent.of(job, JobLifecycleEvent.Kind.COMPLETED, null, now)));
    }

    /**
     * Records a failed attempt. Schedules a retry with exponential backoff while attempts
     * remain, otherwise moves the job to FAILED for good.
     *
     * @return the resulting state, or empty if the job was no longer ACTIVE
     */
    @Transactional
    public Optional<JobState> failAttempt(Long jobId, int attempt, String error) {
        Instant now = Instant.now(clock);
        NotificationJob cur = jobRepository.findById(jobId).orElse(null);
        if (cur == null || cur.getState() != JobState.ACTIVE || cur.getAttemptsMade() != attempt) {
            log.warn("[JobStore] fail ignored jobId={}, attempt={} (not ACTIVE for this attempt)", jobId, attempt);
            return Optional.empty();
        }
        String reason = truncate(error);

        if (cur.getAttemptsMade() >= cur.getMaxAttempts()) {
            if (jobRepository.failIfActive(jobId, attempt, reason, now) == 0) return Optional.empty();
            events.publishEvent(JobLifecycleEvent.of(cur, JobLifecycleEvent.Kind.FAILED, reason, now));
            log.warn("[JobStore] attempts exhausted jobId={}, type={}, attempts={}/{}, err={}",
                    jobId, cur.getType().getCode(), cur.getAttemptsMade(), cur.getMaxAttempts(), reason);
            return Optional.of(JobState.FAILED);
        }

        Duration wait = BackoffPolicy.exponential(cur.getBackoffDelayMillis()).delayAfter(cur.getAttemptsMade());
        if (jobRepository.retryIfActive(jobId, attempt, now.plus(wait), reason) == 0) return Optional.empty();
        events.publishEvent(JobLifecycleEvent.of(cur, JobLifecycleEvent.Kind.RETRY_SCHEDULED,
                "retry in " + wait.toMillis() + "ms: " + reason, now));
        log.info("[JobStore] reserved retry jobId={}, attempt={}/{} after {} ms",
                jobId, cur.getAttemptsMade(), cur.getMaxAttempts(), wait.toMillis());
        return Optional.of(JobState.DELAYED);
    }

    /**
     * An ACTIVE job whose lease ran out counts as a failed attempt.
     */
    @Transactional
    public Optional<JobState> reclaimStalled(Long jobId) {
        Instant now = Instant.now(clock);
        NotificationJob cur = jobRepository.findById(jobId).orElse(null);
        if (cur == null || cur.getState() != JobState.ACTIVE
                || cur.getLeaseUntil() == null || cur.getLeaseUntil().isAfter(now)) {
            return Optional.empty();
        }
        events.publishEvent(JobLifecycleEvent.of(cur, JobLifecycleEvent.Kind.STALLED,
                "lease expired at " + cur.getLeaseUntil(), now));
        return failAttempt(jobId, cur.getAttemptsMade(), "stalled: lease expired at " + cur.getLeaseUntil());
    }

    /**
     * Manually re-queues a terminally failed job with a fresh attempt budget.
     */
    @Transactional
    public NotificationJob retry(Long jobId) {
        NotificationJob job = jobRepository.findById(jobId)
                .orElseThrow(() -> new AppException(JobErrorCode.JOB_NOT_FOUND));

        if (job.getState() != JobState.FAILED) {
            throw new AppException(JobErrorCode.JOB_NOT_FAILED);
        }

        // 재시작 : 시도 횟수 초기화 + 즉시 실행 예약 (발행은 DueJobPromoter가 담당)
        Instant now = Instant.now(clock);
        job.setState(JobState.WAITING);
        job.setAttemptsMade(0);
        job.setLeaseUntil(null);
        job.setFinishedAt(null);
        job.setQueuedAt(null);
        job.setRunAt(now);
        NotificationJob saved = jobRepository.save(job);

        events.publishEvent(JobLifecycleEvent.of(saved, JobLifecycleEvent.Kind.ENQUEUED, "manual retry", now));
        log.info("[JobStore] manual retry jobId={}, type={}", jobId, job.getType().getCode());
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<NotificationJob> find(Long jobId) {
        return jobRepository.findById(jobId);
    }

    @Transactional(readOnly = true)
    public QueueStats stats() {
        return new QueueStats(
                jobRepository.countByState(JobState.WAITING),
                jobRepository.countByState(JobState.ACTIVE),
                jobRepository.countByState(JobState.COMPLETED),
                jobRepository.countByState(JobState.FAILED),
                jobRepository.countByState(JobState.DELAYED)
        );
    }

    private void scheduleNextOccurrence(NotificationJob job, Instant now) {
        if (jobRepository.existsByRepeatKeyAndStateIn(job.getRepeatKey(), JobState.PENDING)) {
            return;
        }
        repeatableJobRepository.findByRepeatKey(job.getRepeatKey()).ifPresentOrElse(
                repeatable -> {
                    Instant from = job.getRunAt().isAfter(now) ? job.getRunAt() : now;
                    saveOccurrence(repeatable.getType(), repeatable.getPayloadJson(), repeatable.getCronExpression(),
                            ZoneId.of(repeatable.getZoneId()), repeatable.getRepeatKey(), from);
                },
                () -> log.warn("[JobStore] repeatable registration missing key={}, recurrence stops", job.getRepeatKey()));
    }

    private NotificationJob saveOccurrence(NotificationJobType type, String payloadJson, String cron,
                                           ZoneId zone, String repeatKey, Instant from) {
        Instant runAt = CronSchedule.next(cron, zone, from);
        NotificationJob occurrence = newJob(type, payloadJson, runAt, JobState.DELAYED);
        occurrence.setCronExpression(cron);
        occurrence.setRepeatKey(repeatKey);
        occurrence = jobRepository.save(occurrence);

        events.publishEvent(JobLifecycleEvent.of(occurrence, JobLifecycleEvent.Kind.ENQUEUED,
                "repeat " + cron + " " + zone.getId(), Instant.now(clock)));
        log.info("[JobStore] repeatable occurrence jobId={}, key={}, runAt={}", occurrence.getId(), repeatKey, runAt);
        return occurrence;
    }

    private NotificationJob newJob(NotificationJobType type, String payloadJson, Instant runAt, JobState state) {
        return NotificationJob.builder()
                .type(type)
                .payloadJson(payloadJson)
                .state(state)
                .attemptsMade(0)
                .maxAttempts(properties.attempts())
                .backoffDelayMillis(properties.backoffDelay().toMillis())
                .runAt(runAt)
                .build();
    }

    private String write(NotificationPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new AppException(JobErrorCode.PAYLOAD_SERIALIZATION_FAILED, e);
        }
    }

    private static String truncate(String error) {
        if (error == null) return null;
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }
}
