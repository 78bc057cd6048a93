package com.yerin.coursenotify.domain.course;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "activity_trackers", uniqueConstraints = {
        @UniqueConstraint(name = "unique_course_facilitator_week",
                columnNames = {"course_offering_id", "facilitator_id", "week_number"})
})
public class ActivityTracker {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name="course_offering_id", nullable=false)
    private Long courseOfferingId;

    @Column(name="facilitator_id", nullable=false)
    private Long facilitatorId;

    @Column(name="week_number", nullable=false)
    private int weekNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable=false, length=20)
    private SubmissionStatus status;

    @Column(name="due_date", nullable=false)
    private Instant dueDate;

    @Column(name="submitted_at")
    private Instant submittedAt;

    public boolean isSubmitted() {
        return status == SubmissionStatus.SUBMITTED;
    }
}
