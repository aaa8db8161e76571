package com.minidrive.common.security.jwt;

import java.time.Instant;
import java.util.UUID;

/** 검증된 액세스 토큰에서 꺼낸 클레임 */
public record SessionClaims(
        UUID userId,
        String email,
        String sessionToken, // sid 클레임
        Instant expiresAt
) {
}
