package com.minidrive.identity.dto;

import com.minidrive.identity.entity.User;

import java.util.UUID;

/** GET /api/auth/me - 다른 서비스의 세션 검증 응답으로도 쓰인다 */
public record CurrentUserResponse(UUID id, String email, String displayName, boolean active) {

    public static CurrentUserResponse from(User user) {
        return new CurrentUserResponse(user.getId(), user.getEmail(), user.getDisplayName(), user.isActive());
    }
}
