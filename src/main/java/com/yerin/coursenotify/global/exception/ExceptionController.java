package com.yerin.coursenotify.global.exception;

import com.yerin.coursenotify.global.dto.ErrorResponse;
import com.yerin.coursenotify.global.exception.code.CommonErrorCode;
import com.yerin.coursenotify.global.exception.code.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class ExceptionController {

    @ExceptionHandler(AppException.class)
    public ResponseEntity<ErrorResponse> handleAppException(AppException e, HttpServletRequest request) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode.isServerError()) {
            log.error("[Api] {} {} -> {} {}", request.getMethod(), request.getRequestURI(),
                    errorCode.getCode(), errorCode.getMessage(), e);
        } else {
            log.warn("[Api] {} {} -> {} {}", request.getMethod(), request.getRequestURI(),
                    errorCode.getCode(), errorCode.getMessage());
        }
        return respond(errorCode, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e,
                                                            HttpServletRequest request) {
        ErrorCode errorCode = CommonErrorCode.INVALID_PARAMETER.withDetail(e.getName() + " 값이 올바르지 않습니다.");
        log.warn("[Api] {} {} -> invalid {}={}", request.getMethod(), request.getRequestURI(),
                e.getName(), e.getValue());
        return respond(errorCode, request);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e,
                                                             HttpServletRequest request) {
        log.warn("[Api] {} {} -> missing header {}", request.getMethod(), request.getRequestURI(), e.getHeaderName());
        return respond(CommonErrorCode.UNAUTHORIZED, request);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleStore(DataAccessException e, HttpServletRequest request) {
        log.error("[Api] {} {} -> store unavailable", request.getMethod(), request.getRequestURI(), e);
        return respond(CommonErrorCode.STORE_UNAVAILABLE, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAll(Exception e, HttpServletRequest request) {
        log.error("[Api] {} {} -> unhandled", request.getMethod(), request.getRequestURI(), e);
        return respond(CommonErrorCode.INTERNAL_SERVER_ERROR, request);
    }

    private static ResponseEntity<ErrorResponse> respond(ErrorCode errorCode, HttpServletRequest request) {
        return ResponseEntity.status(errorCode.getHttpStatus()).body(ErrorResponse.of(errorCode, request));
    }
}
