package com.yerin.coursenotify.repository;

import com.yerin.coursenotify.domain.course.ActivityTracker;
import com.yerin.coursenotify.domain.course.SubmissionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface ActivityTrackerRepository extends JpaRepository<ActivityTracker, Long> {

    Optional<ActivityTracker> findByFacilitatorIdAndCourseOfferingIdAndWeekNumber(
            Long facilitatorId, Long courseOfferingId, int weekNumber);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ActivityTracker a set a.status = :status where a.id = :id")
    int updateStatus(@Param("id") Long id, @Param("status") SubmissionStatus status);
}
