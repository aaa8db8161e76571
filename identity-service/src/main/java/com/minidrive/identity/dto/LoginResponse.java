package com.minidrive.identity.dto;

import java.time.Instant;
import java.util.UUID;

public record LoginResponse(String token, Instant expiresAt, UserSummary user) {

    public record UserSummary(UUID id, String email, String displayName, Instant lastLoginAt) {}
}
