package com.minidrive.audit.entity;

import com.minidrive.common.web.request.ClientInfo;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;
import java.util.UUID;

/**
 * 감사 로그 한 건. 저장 후 변경하지 않는다.
 */
@Entity
@Table(name = "audit_logs", indexes = {
        @Index(name = "idx_audit_user_created", columnList = "userId, createdAt"),
        @Index(name = "idx_audit_entity", columnList = "entityType, entityId"),
        @Index(name = "idx_audit_action_created", columnList = "action, createdAt")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class AuditLog {

    public static final int MAX_TEXT_LENGTH = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 100)
    private String action;

    @Column(nullable = false, length = 100)
    private String entityType;

    @Column(nullable = false, length = 100)
    private String entityId;

    private UUID userId;

    @Column(length = MAX_TEXT_LENGTH)
    private String details;

    @Column(length = ClientInfo.MAX_IP_ADDRESS_LENGTH)
    private String ipAddress;

    @Column(length = ClientInfo.MAX_USER_AGENT_LENGTH)
    private String userAgent;

    @Column(nullable = false)
    private boolean success;

    @Column(length = MAX_TEXT_LENGTH)
    private String errorMessage;

    @CreatedDate
    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Builder
    public AuditLog(String action, String entityType, String entityId, UUID userId, String details,
                    String ipAddress, String userAgent, boolean success, String errorMessage) {
        this.action = action;
        this.entityType = entityType;
        this.entityId = entityId;
        this.userId = userId;
        this.details = details;
        this.ipAddress = ipAddress;
        this.userAgent = userAgent;
        this.success = success;
        this.errorMessage = errorMessage;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AuditLog other)) return false;
        return id != null && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
