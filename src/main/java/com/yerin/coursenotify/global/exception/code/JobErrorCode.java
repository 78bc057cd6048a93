package com.yerin.coursenotify.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum JobErrorCode implements ErrorCode {
    JOB_NOT_FOUND(HttpStatus.NOT_FOUND, "작업을 찾을 수 없습니다.", "JOB-001"),
    JOB_NOT_FAILED(HttpStatus.BAD_REQUEST, "FAILED 상태의 작업만 재시도할 수 있습니다.", "JOB-002"),
    PAYLOAD_TYPE_MISMATCH(HttpStatus.BAD_REQUEST, "작업 타입과 페이로드가 일치하지 않습니다.", "JOB-003"),
    PAYLOAD_SERIALIZATION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "작업 페이로드를 직렬화할 수 없습니다.", "JOB-004"),
    INVALID_CRON(HttpStatus.BAD_REQUEST, "cron 표현식이 올바르지 않습니다.", "JOB-005");

    private final HttpStatus httpStatus;
    private final String message;
    private final String code;
}
