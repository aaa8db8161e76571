package com.minidrive.audit.repository;

import com.minidrive.audit.entity.AuditLog;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.UUID;

/**
 * 감사 로그 조회 조건. null 인자는 조건을 걸지 않는다.
 */
public final class AuditLogSpecifications {

    private AuditLogSpecifications() {
    }

    public static Specification<AuditLog> byUser(UUID userId) {
        return (root, query, cb) -> cb.equal(root.get("userId"), userId);
    }

    public static Specification<AuditLog> byEntity(String entityType, String entityId) {
        return (root, query, cb) -> cb.and(
                cb.equal(root.get("entityType"), entityType),
                cb.equal(root.get("entityId"), entityId));
    }

    public static Specification<AuditLog> byAction(String action) {
        return (root, query, cb) -> cb.equal(root.get("action"), action);
    }

    public static Specification<AuditLog> createdBetween(Instant from, Instant to) {
        return (root, query, cb) -> {
            if (from != null && to != null) {
                return cb.between(root.get("createdAt"), from, to);
            }
            if (from != null) {
                return cb.greaterThanOrEqualTo(root.get("createdAt"), from);
            }
            if (to != null) {
                return cb.lessThanOrEqualTo(root.get("createdAt"), to);
            }
            return null;
        };
    }
}
