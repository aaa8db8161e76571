package com.minidrive.common.web.auth;

import java.util.Optional;

/** Authorization 헤더에서 토큰 추출 */
public final class BearerTokens {

    public static final String AUTHORIZATION = "Authorization";
    private static final String PREFIX = "Bearer ";

    private BearerTokens() {
    }

    /**
     * "Bearer xxx" → "xxx". 접두사가 없으면 헤더 값 전체를 토큰으로 본다.
     */
    public static Optional<String> extract(String header) {
        if (header == null || header.isBlank()) {
            return Optional.empty();
        }
        String value = header.trim();
        if (value.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            value = value.substring(PREFIX.length()).trim();
        }
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }
}
