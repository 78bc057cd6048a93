package com.yerin.coursenotify.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 작업별 상태 변화 기록 (FAILED 작업 점검용).
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "notification_job_event_log",
        indexes = @Index(name = "idx_job_event_log_job_id_ts", columnList = "job_id, ts"))
public class JobEventLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name="job_id", nullable=false)
    private Long jobId;

    @Enumerated(EnumType.STRING)
    @Column(name="job_type", length=60)
    private NotificationJobType jobType;

    @Enumerated(EnumType.STRING)
    @Column(name="event_type", nullable=false, length=30)
    private JobLifecycleEvent.Kind eventType;

    @Column(columnDefinition = "text")
    private String message;

    @Column(nullable=false)
    private Instant ts;

    public static JobEventLog of(JobLifecycleEvent event) {
        return JobEventLog.builder()
                .jobId(event.jobId())
                .jobType(event.type())
                .eventType(event.kind())
                .message(event.message())
                .ts(event.at() == null ? Instant.now() : event.at())
                .build();
    }
}
