package com.yerin.coursenotify.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.coursenotify.config.NotifyQueueProperties;
import com.yerin.coursenotify.config.NotifyScheduleProperties;
import com.yerin.coursenotify.domain.NotificationJob;
import com.yerin.coursenotify.domain.course.ActivityDeadline;
import com.yerin.coursenotify.domain.event.ActivityTrackerCreatedEvent;
import com.yerin.coursenotify.repository.NotificationJobRepository;
import com.yerin.coursenotify.repository.RepeatableJobRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.EnableTransactionManagement;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;
import org.springframework.transaction.support.DefaultTransactionStatus;
import org.springframework.transaction.support.SmartTransactionObject;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("예약 실패와 도메인 트랜잭션 분리 테스트")
public class NotificationSchedulingTransactionTest {
    static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    AnnotationConfigApplicationContext ctx;
    List<String> trail;

    @BeforeEach
    void setUp() {
        ctx = new AnnotationConfigApplicationContext(Config.class);
        trail = ctx.getBean(Config.class).trail;
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    @Test
    @DisplayName("작업 저장이 실패해도 트래커 생성 트랜잭션은 커밋된다")
    void domain_write_commits_when_enqueue_fails() {
        NotificationJobRepository jobRepository = ctx.getBean(NotificationJobRepository.class);
        when(jobRepository.save(any(NotificationJob.class))).thenAnswer(inv -> {
            trail.add("save");
            throw new DataAccessResourceFailureException("db down");
        });
        var deadline = new ActivityDeadline(7L, 3L, 2, Instant.parse("2026-03-06T17:00:00Z"));

        assertThatCode(() -> ctx.getBean(TrackerService.class).createTracker(deadline))
                .doesNotThrowAnyException();

        // 커밋 이후에 리마인더/지각 알림이 각자 새 트랜잭션에서 시도되고 롤백된다
        assertThat(trail).containsExactly(
                "begin", "domain write", "commit",
                "begin", "save", "rollback",
                "begin", "save", "rollback");
        verify(jobRepository, times(2)).save(any(NotificationJob.class));
    }

    @Test
    @DisplayName("도메인 쓰기가 롤백되면 알림을 예약하지 않는다")
    void nothing_scheduled_when_domain_write_rolls_back() {
        NotificationJobRepository jobRepository = ctx.getBean(NotificationJobRepository.class);
        var deadline = new ActivityDeadline(7L, 3L, 2, Instant.parse("2026-03-06T17:00:00Z"));

        assertThatThrownBy(() -> ctx.getBean(TrackerService.class).createTrackerThenFail(deadline))
                .isInstanceOf(IllegalStateException.class);

        assertThat(trail).containsExactly("begin", "domain write", "rollback");
        verify(jobRepository, never()).save(any());
    }

    public static class TrackerService {
        private final ApplicationEventPublisher events;
        private final List<String> trail;

        public TrackerService(ApplicationEventPublisher events, List<String> trail) {
            this.events = events;
            this.trail = trail;
        }

        @Transactional
        public void createTracker(ActivityDeadline deadline) {
            trail.add("domain write");
            events.publishEvent(new ActivityTrackerCreatedEvent(deadline));
        }

        @Transactional
        public void createTrackerThenFail(ActivityDeadline deadline) {
            createTracker(deadline);
            throw new IllegalStateException("validation failed after insert");
        }
    }

    @Configuration
    @EnableTransactionManagement
    static class Config {
        final List<String> trail = new ArrayList<>();

        @Bean
        RecordingTransactionManager transactionManager() {
            return new RecordingTransactionManager(trail);
        }

        @Bean
        NotificationJobRepository notificationJobRepository() {
            return mock(NotificationJobRepository.class);
        }

        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }

        @Bean
        NotificationJobStore notificationJobStore(NotificationJobRepository jobRepository,
                                                  ApplicationEventPublisher events, Clock clock) {
            return new NotificationJobStore(jobRepository, mock(RepeatableJobRepository.class),
                    NotifyQueueProperties.defaults(), new ObjectMapper().findAndRegisterModules(), events, clock);
        }

        @Bean
        NotificationScheduler notificationScheduler(NotificationJobStore jobStore, Clock clock) {
            return new NotificationScheduler(jobStore,
                    new NotifyScheduleProperties(null, null, null, null, false), clock);
        }

        @Bean
        NotificationDomainEventListener notificationDomainEventListener(NotificationScheduler scheduler) {
            return new NotificationDomainEventListener(scheduler);
        }

        @Bean
        TrackerService trackerService(ApplicationEventPublisher events) {
            return new TrackerService(events, trail);
        }
    }

    /**
     * Holder-per-transaction manager: a transaction stays visible to participants until
     * cleanup, the same way a JDBC connection holder does.
     */
    static class RecordingTransactionManager extends AbstractPlatformTransactionManager {
        private final List<String> trail;

        RecordingTransactionManager(List<String> trail) {
            this.trail = trail;
        }

        static class Holder {
            boolean rollbackOnly;
        }

        static class Tx implements SmartTransactionObject {
            Holder holder;
            boolean newHolder;

            @Override
            public boolean isRollbackOnly() {
                return holder != null && holder.rollbackOnly;
            }

            @Override
            public void flush() {
            }
        }

        @Override
        protected Object doGetTransaction() {
            Tx tx = new Tx();
            tx.holder = (Holder) TransactionSynchronizationManager.getResource(this);
            return tx;
        }

        @Override
        protected boolean isExistingTransaction(Object transaction) {
            return ((Tx) transaction).holder != null;
        }

        @Override
        protected void doBegin(Object transaction, TransactionDefinition definition) {
            Tx tx = (Tx) transaction;
            tx.holder = new Holder();
            tx.newHolder = true;
            TransactionSynchronizationManager.bindResource(this, tx.holder);
            trail.add("begin");
        }

        @Override
        protected Object doSuspend(Object transaction) {
            ((Tx) transaction).holder = null;
            return TransactionSynchronizationManager.unbindResource(this);
        }

        @Override
        protected void doResume(Object transaction, Object suspendedResources) {
            TransactionSynchronizationManager.bindResource(this, suspendedResources);
        }

        @Override
        protected void doCommit(DefaultTransactionStatus status) {
            trail.add("commit");
        }

        @Override
        protected void doRollback(DefaultTransactionStatus status) {
            trail.add("rollback");
        }

        @Override
        protected void doSetRollbackOnly(DefaultTransactionStatus status) {
            ((Tx) status.getTransaction()).holder.rollbackOnly = true;
            trail.add("rollback-only");
        }

        @Override
        protected void doCleanupAfterCompletion(Object transaction) {
            if (((Tx) transaction).newHolder) {
                TransactionSynchronizationManager.unbindResourceIfPossible(this);
            }
        }
    }
}
