package com.yerin.coursenotify.global.exception.code;

import org.springframework.http.HttpStatus;

record DetailedErrorCode(ErrorCode origin, String detail) implements ErrorCode {

    @Override
    public HttpStatus getHttpStatus() {
        return origin.getHttpStatus();
    }

    @Override
    public String getMessage() {
        return detail;
    }

    @Override
    public String getCode() {
        return origin.getCode();
    }
}
