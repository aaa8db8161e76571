package com.minidrive.audit.dto;

import com.minidrive.audit.entity.AuditLog;

import java.time.Instant;
import java.util.UUID;

public record AuditLogResponse(
        UUID id,
        String action,
        String entityType,
        String entityId,
        UUID userId,
        String details,
        String ipAddress,
        String userAgent,
        boolean success,
        String errorMessage,
        Instant createdAt
) {
    public static AuditLogResponse from(AuditLog log) {
        return new AuditLogResponse(log.getId(), log.getAction(), log.getEntityType(), log.getEntityId(),
                log.getUserId(), log.getDetails(), log.getIpAddress(), log.getUserAgent(), log.isSuccess(),
                log.getErrorMessage(), log.getCreatedAt());
    }
}
