package com.minidrive.common.client.audit;

import com.minidrive.common.web.request.ClientInfo;

import java.util.UUID;

/**
 * 감사 로그 한 건. audit-service POST /api/audit/log 의 요청 본문.
 */
public record AuditEntry(
        UUID userId,
        String action,        // FileUpload, FileDelete, ...
        String entityType,    // File, Folder, Share
        String entityId,
        boolean success,
        String details,
        String errorMessage,
        String ipAddress,
        String userAgent
) {

    /** 실패 시 엔티티 ID 가 아직 없을 때 사용 */
    public static final String EMPTY_ENTITY_ID = "00000000-0000-0000-0000-000000000000";

    public static AuditEntry success(UUID userId, String action, String entityType, String entityId,
                                     String details, ClientInfo client) {
        return new AuditEntry(userId, action, entityType, entityId, true, details, null,
                ipOf(client), userAgentOf(client));
    }

    public static AuditEntry failure(UUID userId, String action, String entityType, String entityId,
                                     String details, String errorMessage, ClientInfo client) {
        return new AuditEntry(userId, action, entityType, entityId, false, details, errorMessage,
                ipOf(client), userAgentOf(client));
    }

    private static String ipOf(ClientInfo client) {
        return client == null ? null : client.ipAddress();
    }

    private static String userAgentOf(ClientInfo client) {
        return client == null ? null : client.userAgent();
    }
}
