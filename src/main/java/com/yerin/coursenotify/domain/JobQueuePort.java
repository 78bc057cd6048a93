package com.yerin.coursenotify.domain;

/**
 * 실행 가능해진 작업 id를 워커에게 전달하는 통로. 작업 본문과 상태는 DB가 가진다.
 */
public interface JobQueuePort {
    void publish(NotificationJobType type, Long jobId);

    long backlog();
}
