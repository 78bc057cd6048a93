package com.yerin.coursenotify.repository;

import com.yerin.coursenotify.domain.JobState;
import com.yerin.coursenotify.domain.NotificationJob;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface NotificationJobRepository extends JpaRepository<NotificationJob, Long> {

    long countByState(JobState state);

    Optional<NotificationJob> findFirstByRepeatKeyAndStateInOrderByRunAtAsc(String repeatKey, Collection<JobState> states);

    boolean existsByRepeatKeyAndStateIn(String repeatKey, Collection<JobState> states);

    List<NotificationJob> findTop100ByStateAndLeaseUntilLessThanEqualOrderByLeaseUntilAsc(
            JobState state, Instant leaseUntil);

    // 실행 시각이 지났는데 아직 스트림에 올리지 않았거나, 올린 지 오래된 작업
    @Query("""
       select j from NotificationJob j
        where j.state in :states
          and j.runAt <= :now
          and (j.queuedAt is null or j.queuedAt < j.runAt or j.queuedAt <= :staleBefore)
        order by j.runAt asc
       """)
    List<NotificationJob> findDueForPublish(@Param("states") Collection<JobState> states,
                                            @Param("now") Instant now,
                                            @Param("staleBefore") Instant staleBefore,
                                            Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update NotificationJob j
          set j.state = com.yerin.coursenotify.domain.JobState.WAITING,
              j.queuedAt = :queuedAt
        where j.id = :id
          and j.state in (com.yerin.coursenotify.domain.JobState.WAITING,
                          com.yerin.coursenotify.domain.JobState.DELAYED)
       """)
    int markQueued(@Param("id") Long id, @Param("queuedAt") Instant queuedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update NotificationJob j
          set j.state = com.yerin.coursenotify.domain.JobState.ACTIVE,
              j.attemptsMade = j.attemptsMade + 1,
              j.leaseUntil = :leaseUntil
        where j.id = :id
          and j.state in (com.yerin.coursenotify.domain.JobState.WAITING,
                          com.yerin.coursenotify.domain.JobState.DELAYED)
          and j.runAt <= :now
       """)
    int claimIfDue(@Param("id") Long id,
                   @Param("now") Instant now,
                   @Param("leaseUntil") Instant leaseUntil);

    // 결과 반영은 해당 시도(attempt)를 가진 워커만: 리스 만료 후 재점유된 작업을 덮어쓰지 않는다
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update NotificationJob j
          set j.state = com.yerin.coursenotify.domain.JobState.COMPLETED,
              j.leaseUntil = null,
              j.finishedAt = :finishedAt
        where j.id = :id
          and j.state = com.yerin.coursenotify.domain.JobState.ACTIVE
          and j.attemptsMade = :attempt
       """)
    int completeIfActive(@Param("id") Long id,
                         @Param("attempt") int attempt,
                         @Param("finishedAt") Instant finishedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update NotificationJob j
          set j.state = com.yerin.coursenotify.domain.JobState.DELAYED,
              j.runAt = :runAt,
              j.leaseUntil = null,
              j.lastError = :error
        where j.id = :id
          and j.state = com.yerin.coursenotify.domain.JobState.ACTIVE
          and j.attemptsMade = :attempt
       """)
    int retryIfActive(@Param("id") Long id,
                      @Param("attempt") int attempt,
                      @Param("runAt") Instant runAt,
                      @Param("error") String error);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       update NotificationJob j
          set j.state = com.yerin.coursenotify.domain.JobState.FAILED,
              j.leaseUntil = null,
              j.lastError = :error,
              j.finishedAt = :finishedAt
        where j.id = :id
          and j.state = com.yerin.coursenotify.domain.JobState.ACTIVE
          and j.attemptsMade = :attempt
       """)
    int failIfActive(@Param("id") Long id,
                     @Param("attempt") int attempt,
                     @Param("error") String error,
                     @Param("finishedAt") Instant finishedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
       delete from NotificationJob j
        where j.state = :state
          and j.finishedAt < :threshold
       """)
    int deleteFinishedBefore(@Param("state") JobState state, @Param("threshold") Instant threshold);

    @Query("""
       select j.id from NotificationJob j
        where j.state = :state
        order by j.finishedAt desc, j.id desc
       """)
    List<Long> findIdsNewestFirst(@Param("state") JobState state);
}
