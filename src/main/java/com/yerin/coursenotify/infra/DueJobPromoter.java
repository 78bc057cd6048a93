package com.yerin.coursenotify.infra;

import com.yerin.coursenotify.config.NotifyQueueProperties;
import com.yerin.coursenotify.domain.JobQueuePort;
import com.yerin.coursenotify.domain.JobState;
import com.yerin.coursenotify.domain.NotificationJob;
import com.yerin.coursenotify.repository.NotificationJobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Publishes jobs whose run time has come to the stream. A job published once but still
 * waiting after one lease period is published again.
 */
@Slf4j
@Component
public class DueJobPromoter {

    private final NotificationJobRepository jobRepository;
    private final JobQueuePort queuePort;
    private final NotifyQueueProperties queueProperties;
    private final TransactionTemplate tx;
    private final Clock clock;

    @Value("${notify.promoter.batchSize:100}")
    private int batchSize = 100;

    public DueJobPromoter(NotificationJobRepository jobRepository,
                          JobQueuePort queuePort,
                          NotifyQueueProperties queueProperties,
                          PlatformTransactionManager txManager,
                          Clock clock) {
        this.jobRepository = jobRepository;
        this.queuePort = queuePort;
        this.queueProperties = queueProperties;
        this.tx = new TransactionTemplate(txManager);
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${notify.promoter.intervalMillis:1000}")
    public int promoteDue() {
        Instant now = Instant.now(clock);

        List<NotificationJob> due = jobRepository.findDueForPublish(
                JobState.PENDING, now, now.minus(queueProperties.lease()), PageRequest.of(0, batchSize));

        int published = 0;
        for (NotificationJob j : due) {
            try {
                queuePort.publish(j.getType(), j.getId());
                tx.execute(status -> jobRepository.markQueued(j.getId(), now));
                published++;
            } catch (Exception e) {
                log.warn("[DueJobPromoter] publish fail jobId={}, err={}", j.getId(), e.toString());
            }
        }
        if (published > 0) {
            log.debug("[DueJobPromoter] published={} (due={})", published, due.size());
        }
        return published;
    }
}
