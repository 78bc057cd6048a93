package com.yerin.coursenotify.web;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

@Slf4j
@Component
public class AdminTokenInterceptor implements HandlerInterceptor {
    static final String HEADER = "X-Admin-Token";

    private final String adminToken;

    public AdminTokenInterceptor(@Value("${notify.admin.token:}") String adminToken) {
        this.adminToken = adminToken;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String token = request.getHeader(HEADER);
        // 토큰이 설정되지 않았으면 관리자 API는 항상 닫혀 있다
        if (adminToken != null && !adminToken.isBlank() && token != null
                && MessageDigest.isEqual(adminToken.getBytes(StandardCharsets.UTF_8),
                                         token.getBytes(StandardCharsets.UTF_8))) {
            return true;
        }
        log.warn("[Admin] rejected {} {}", request.getMethod(), request.getRequestURI());
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        return false;
    }
}
