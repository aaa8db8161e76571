package com.minidrive.sharing.dto;

import java.time.Instant;

/** null 필드는 변경하지 않는다. password 가 빈 문자열이면 비밀번호 보호 해제. */
public record UpdateShareRequest(
        String permission,
        Instant expiresAt,
        Boolean active,
        String password,
        Integer maxDownloads,
        String notes
) {
}
