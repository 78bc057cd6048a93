package com.yerin.coursenotify.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 반복(cron) 작업 등록 정보. 동일한 타입/cron/타임존 조합은 한 번만 등록된다.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "repeatable_job", uniqueConstraints = {
        @UniqueConstraint(name = "uk_repeatable_job_key", columnNames = "repeat_key")
})
public class RepeatableJob {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name="repeat_key", nullable=false, length=200)
    private String repeatKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable=false, length=60)
    private NotificationJobType type;

    @Column(name="cron_expression", nullable=false, length=120)
    private String cronExpression;

    @Column(name="zone_id", nullable=false, length=60)
    private String zoneId;

    @Column(name="payload_json", nullable=false, columnDefinition = "text")
    private String payloadJson;

    @Column(name="created_at", nullable=false)
    private Instant createdAt;

    public static String keyOf(NotificationJobType type, String cronExpression, String zoneId) {
        return type.getCode() + ":" + cronExpression + ":" + zoneId;
    }

    @PrePersist
    void pre() { if (createdAt == null) createdAt = Instant.now(); }
}
