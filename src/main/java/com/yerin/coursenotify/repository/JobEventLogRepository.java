package com.yerin.coursenotify.repository;

import com.yerin.coursenotify.domain.JobEventLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface JobEventLogRepository extends JpaRepository<JobEventLog, Long> {
    List<JobEventLog> findByJobIdOrderByTsAsc(Long jobId);
}
