package com.yerin.coursenotify.domain.course;

import java.util.List;
import java.util.Optional;

/**
 * Read/write access to the course-management data the notification worker needs.
 */
public interface CourseDataStore {

    Optional<ActivityTracker> findSubmission(Long facilitatorId, Long courseOfferingId, int weekNumber);

    Optional<AppUser> findUser(Long id);

    /**
     * @param withCourse fetch the owning course in the same query so it can be read
     *                   outside a persistence context
     */
    Optional<CourseOffering> findCourseOffering(Long id, boolean withCourse);

    List<AppUser> findUsersByRole(UserRole role, boolean activeOnly);

    void updateSubmissionStatus(Long submissionId, SubmissionStatus status);
}
