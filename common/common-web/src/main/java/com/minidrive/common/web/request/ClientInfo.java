package com.minidrive.common.web.request;

import jakarta.servlet.http.HttpServletRequest;

/**
 * 요청자 IP / User-Agent (감사 로그, 세션 기록용)
 *
 * <p>Gateway 뒤에서는 X-Forwarded-For 의 첫 번째 값이 실제 클라이언트 IP 다.
 * 두 값 모두 클라이언트가 보낸 헤더이므로 저장 컬럼 길이에 맞춰 자른다.</p>
 */
public record ClientInfo(String ipAddress, String userAgent) {

    public static final int MAX_IP_ADDRESS_LENGTH = 64;
    public static final int MAX_USER_AGENT_LENGTH = 512;

    public ClientInfo {
        ipAddress = truncate(ipAddress, MAX_IP_ADDRESS_LENGTH);
        userAgent = truncate(userAgent, MAX_USER_AGENT_LENGTH);
    }

    public static ClientInfo from(HttpServletRequest request) {
        return new ClientInfo(resolveIp(request), request.getHeader("User-Agent"));
    }

    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private static String resolveIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        return request.getRemoteAddr();
    }
}
