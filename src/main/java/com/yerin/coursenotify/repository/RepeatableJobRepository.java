package com.yerin.coursenotify.repository;

import com.yerin.coursenotify.domain.RepeatableJob;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface RepeatableJobRepository extends JpaRepository<RepeatableJob, Long> {
    Optional<RepeatableJob> findByRepeatKey(String repeatKey);
}
