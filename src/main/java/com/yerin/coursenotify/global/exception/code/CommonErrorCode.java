package com.yerin.coursenotify.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum CommonErrorCode implements ErrorCode {
    INVALID_PARAMETER(HttpStatus.BAD_REQUEST, "요청 값이 올바르지 않습니다.", "COMMON-001"),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "관리자 토큰이 필요합니다.", "COMMON-002"),
    STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "작업 저장소에 접근할 수 없습니다.", "COMMON-003"),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "알림 서버 내부 오류입니다.", "COMMON-004");

    private final HttpStatus httpStatus;
    private final String message;
    private final String code;
}
