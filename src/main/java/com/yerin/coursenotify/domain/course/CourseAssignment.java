package com.yerin.coursenotify.domain.course;

import java.util.Objects;

public record CourseAssignment(Long facilitatorId, Long courseOfferingId) {
    public CourseAssignment {
        Objects.requireNonNull(facilitatorId, "facilitatorId");
        Objects.requireNonNull(courseOfferingId, "courseOfferingId");
    }

    public static CourseAssignment from(CourseOffering offering) {
        return new CourseAssignment(offering.getFacilitatorId(), offering.getId());
    }
}
