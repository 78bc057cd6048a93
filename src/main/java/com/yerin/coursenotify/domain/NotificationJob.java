package com.yerin.coursenotify.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "notification_job", indexes = {
        @Index(name = "idx_notification_job_state_run_at", columnList = "state, run_at"),
        @Index(name = "idx_notification_job_repeat_key", columnList = "repeat_key")
})
@DynamicUpdate
public class NotificationJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable=false, length=60)
    private NotificationJobType type;

    @Column(name="payload_json", nullable=false, columnDefinition = "text")
    private String payloadJson;

    @Enumerated(EnumType.STRING)
    @Column(nullable=false, length=20)
    private JobState state;

    @Column(name="attempts_made", nullable=false)
    private int attemptsMade;

    @Column(name="max_attempts", nullable=false)
    private int maxAttempts;

    @Column(name="backoff_delay_millis", nullable=false)
    private long backoffDelayMillis;

    @Column(name="run_at", nullable=false)
    private Instant runAt;

    @Column(name="cron_expression", length=120)
    private String cronExpression;

    @Column(name="repeat_key", length=200)
    private String repeatKey;

    @Column(name="lease_until")
    private Instant leaseUntil;

    @Column(name="queued_at")
    private Instant queuedAt;

    @Column(name="last_error", columnDefinition = "text")
    private String lastError;

    @Column(name="created_at", nullable=false)
    private Instant createdAt;

    @Column(name="updated_at", nullable=false)
    private Instant updatedAt;

    @Column(name="finished_at")
    private Instant finishedAt;

    public boolean isRecurring() {
        return repeatKey != null;
    }

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
        if (state == null) state = JobState.WAITING;
        if (runAt == null) runAt = now;
    }

    @PreUpdate
    void preUpdate() { updatedAt = Instant.now(); }
}
