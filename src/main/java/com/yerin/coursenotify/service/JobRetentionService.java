package com.yerin.coursenotify.service;

import com.yerin.coursenotify.config.NotifyQueueProperties;
import com.yerin.coursenotify.domain.JobState;
import com.yerin.coursenotify.repository.NotificationJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class JobRetentionService {

    private final NotificationJobRepository jobRepository;
    private final NotifyQueueProperties properties;
    private final Clock clock;

    @Transactional
    public RetentionResult clean() {
        Instant now = Instant.now(clock);
        int completedExpired = jobRepository.deleteFinishedBefore(JobState.COMPLETED,
                now.minus(properties.completedMaxAge()));
        int failedExpired = jobRepository.deleteFinishedBefore(JobState.FAILED,
                now.minus(properties.failedMaxAge()));

        List<Long> completed = jobRepository.findIdsNewestFirst(JobState.COMPLETED);
        int trimmed = 0;
        if (completed.size() > properties.completedKeep()) {
            List<Long> surplus = completed.subList(properties.completedKeep(), completed.size());
            jobRepository.deleteAllByIdInBatch(surplus);
            trimmed = surplus.size();
        }

        RetentionResult result = new RetentionResult(completedExpired, trimmed, failedExpired);
        if (result.total() > 0) {
            log.info("[Retention] removed completedExpired={}, completedTrimmed={}, failedExpired={}",
                    completedExpired, trimmed, failedExpired);
        }
        return result;
    }
}
