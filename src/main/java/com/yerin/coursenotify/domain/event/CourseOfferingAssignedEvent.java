package com.yerin.coursenotify.domain.event;

import com.yerin.coursenotify.domain.course.CourseAssignment;

public record CourseOfferingAssignedEvent(CourseAssignment assignment) {}
