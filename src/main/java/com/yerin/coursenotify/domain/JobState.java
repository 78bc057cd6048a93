package com.yerin.coursenotify.domain;

import java.util.EnumSet;
import java.util.Set;

public enum JobState {
    WAITING,
    ACTIVE,
    COMPLETED,
    FAILED,
    DELAYED;

    // 아직 실행 전인 상태 (반복 작업 중복 판단 기준)
    public static final Set<JobState> PENDING = EnumSet.of(WAITING, DELAYED);

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED;
    }
}
