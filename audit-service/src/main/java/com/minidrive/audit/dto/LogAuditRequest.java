package com.minidrive.audit.dto;

import java.util.UUID;

/** POST /api/audit/log 본문. success 가 빠지면 true. */
public record LogAuditRequest(
        UUID userId,
        String action,
        String entityType,
        String entityId,
        Boolean success,
        String details,
        String errorMessage,
        String ipAddress,
        String userAgent
) {
    public boolean succeeded() {
        return success == null || success;
    }
}
