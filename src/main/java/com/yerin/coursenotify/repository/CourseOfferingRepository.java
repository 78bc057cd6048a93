package com.yerin.coursenotify.repository;

import com.yerin.coursenotify.domain.course.CourseOffering;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface CourseOfferingRepository extends JpaRepository<CourseOffering, Long> {

    @EntityGraph(attributePaths = "course")
    @Query("select o from CourseOffering o where o.id = :id")
    Optional<CourseOffering> findWithCourseById(@Param("id") Long id);
}
