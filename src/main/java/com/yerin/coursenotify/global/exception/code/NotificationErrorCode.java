package com.yerin.coursenotify.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum NotificationErrorCode implements ErrorCode {
    FACILITATOR_NOT_FOUND(HttpStatus.NOT_FOUND, "퍼실리테이터를 찾을 수 없습니다.", "NOTI-001"),
    COURSE_OFFERING_NOT_FOUND(HttpStatus.NOT_FOUND, "코스 오퍼링을 찾을 수 없습니다.", "NOTI-002"),
    DELIVERY_FAILED(HttpStatus.BAD_GATEWAY, "알림 메일 발송에 실패했습니다.", "NOTI-003");

    private final HttpStatus httpStatus;
    private final String message;
    private final String code;
}
