package com.minidrive.identity.dto;

import java.time.Instant;
import java.util.UUID;

/** 회원가입 응답 - 가입과 동시에 세션이 발급된다 */
public record RegisterResponse(UserSummary user, SessionSummary session) {

    public record UserSummary(UUID id, String email, String displayName, Instant createdAt) {}

    public record SessionSummary(String token, Instant expiresAt) {}
}
