package com.tokenvault.backend.auth.support;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import jakarta.servlet.http.HttpServletRequest;

/**
 * 요청자 정보(IP / 기기) 추출
 *
 * IP 우선순위: X-Forwarded-For 첫 번째 값 -> X-Real-IP -> remoteAddr
 * (프록시 뒤에 있을 때 remoteAddr 는 프록시 주소라서)
 */
@Component
public class ClientInfoResolver {

    static final String X_FORWARDED_FOR = "X-Forwarded-For";
    static final String X_REAL_IP = "X-Real-IP";

    public String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader(X_FORWARDED_FOR);
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty())
                return first;
        }

        String realIp = request.getHeader(X_REAL_IP);
        if (realIp != null && !realIp.isBlank())
            return realIp.trim();

        return request.getRemoteAddr();
    }

    public String deviceInfo(HttpServletRequest request) {
        String userAgent = request.getHeader(HttpHeaders.USER_AGENT);
        return userAgent == null || userAgent.isBlank() ? null : userAgent;
    }
}
