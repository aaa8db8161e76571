package com.minidrive.sharing.dto;

import java.time.Instant;
import java.util.UUID;

public record CreateShareRequest(
        UUID resourceId,
        String resourceType,
        UUID sharedWithUserId,
        String permission,     // null = view
        boolean publicShare,
        String password,
        Instant expiresAt,
        Integer maxDownloads,
        String notes
) {
}
