package com.yerin.coursenotify.global.exception.code;

import org.springframework.http.HttpStatus;

public interface ErrorCode {
    HttpStatus getHttpStatus();
    String getMessage();
    String getCode();

    /** 코드와 상태는 유지하고 메시지만 구체적인 값으로 바꾼다. */
    default ErrorCode withDetail(String detailMessage) {
        return new DetailedErrorCode(this, detailMessage);
    }

    default boolean isServerError() {
        return getHttpStatus().is5xxServerError();
    }
}
