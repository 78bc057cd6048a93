package com.yerin.coursenotify.infra;

import com.yerin.coursenotify.domain.course.ActivityTracker;
import com.yerin.coursenotify.domain.course.AppUser;
import com.yerin.coursenotify.domain.course.CourseDataStore;
import com.yerin.coursenotify.domain.course.CourseOffering;
import com.yerin.coursenotify.domain.course.SubmissionStatus;
import com.yerin.coursenotify.domain.course.UserRole;
import com.yerin.coursenotify.repository.ActivityTrackerRepository;
import com.yerin.coursenotify.repository.AppUserRepository;
import com.yerin.coursenotify.repository.CourseOfferingRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaCourseDataStore implements CourseDataStore {

    private final ActivityTrackerRepository activityTrackerRepository;
    private final AppUserRepository userRepository;
    private final CourseOfferingRepository courseOfferingRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<ActivityTracker> findSubmission(Long facilitatorId, Long courseOfferingId, int weekNumber) {
        return activityTrackerRepository.findByFacilitatorIdAndCourseOfferingIdAndWeekNumber(
                facilitatorId, courseOfferingId, weekNumber);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AppUser> findUser(Long id) {
        return userRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CourseOffering> findCourseOffering(Long id, boolean withCourse) {
        return withCourse
                ? courseOfferingRepository.findWithCourseById(id)
                : courseOfferingRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AppUser> findUsersByRole(UserRole role, boolean activeOnly) {
        return activeOnly
                ? userRepository.findByRoleAndActiveTrue(role)
                : userRepository.findByRole(role);
    }

    @Override
    @Transactional
    public void updateSubmissionStatus(Long submissionId, SubmissionStatus status) {
        activityTrackerRepository.updateStatus(submissionId, status);
    }
}
