package com.minidrive.audit.service;

import com.minidrive.audit.dto.AuditLogResponse;
import com.minidrive.audit.dto.LogAuditRequest;
import com.minidrive.audit.entity.AuditLog;
import com.minidrive.audit.repository.AuditLogRepository;
import com.minidrive.common.exception.BusinessException;
import com.minidrive.common.exception.ErrorCode;
import com.minidrive.common.web.request.ClientInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static com.minidrive.audit.repository.AuditLogSpecifications.*;
import static com.minidrive.common.web.request.ClientInfo.truncate;

/**
 * 감사 로그 저장/조회.
 *
 * <p>조회는 항상 최신순이며 limit 으로 건수를 제한한다
 * (미지정 또는 0 이하 = {@value #DEFAULT_LIMIT}, 최대 {@value #MAX_LIMIT}).</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AuditService {

    static final int DEFAULT_LIMIT = 100;
    static final int MAX_LIMIT = 1000;

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final AuditLogRepository auditLogRepository;

    @Transactional
    public void log(LogAuditRequest request) {
        requireText(request.action(), "Action");
        requireText(request.entityType(), "EntityType");
        requireText(request.entityId(), "EntityId");

        AuditLog saved = auditLogRepository.save(AuditLog.builder()
                .userId(request.userId())
                .action(request.action())
                .entityType(request.entityType())
                .entityId(request.entityId())
                .success(request.succeeded())
                .details(truncate(request.details(), AuditLog.MAX_TEXT_LENGTH))
                .errorMessage(truncate(request.errorMessage(), AuditLog.MAX_TEXT_LENGTH))
                .ipAddress(truncate(request.ipAddress(), ClientInfo.MAX_IP_ADDRESS_LENGTH))
                .userAgent(truncate(request.userAgent(), ClientInfo.MAX_USER_AGENT_LENGTH))
                .build());

        log.debug("Audit logged: id={}, action={}, entity={}:{}, success={}",
                saved.getId(), saved.getAction(), saved.getEntityType(), saved.getEntityId(), saved.isSuccess());
    }

    public List<AuditLogResponse> userLogs(UUID userId, Integer limit, Instant from, Instant to) {
        return find(byUser(userId).and(createdBetween(from, to)), limit);
    }

    public List<AuditLogResponse> entityLogs(String entityType, String entityId, Integer limit) {
        return find(byEntity(entityType, entityId), limit);
    }

    public List<AuditLogResponse> actionLogs(String action, Integer limit, Instant from, Instant to) {
        return find(byAction(action).and(createdBetween(from, to)), limit);
    }

    static int effectiveLimit(Integer limit) {
        if (limit == null || limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }

    private List<AuditLogResponse> find(Specification<AuditLog> spec, Integer limit) {
        return auditLogRepository.findAll(spec, PageRequest.of(0, effectiveLimit(limit), NEWEST_FIRST))
                .map(AuditLogResponse::from)
                .getContent();
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_AUDIT_ENTRY, field + " cannot be null or empty.");
        }
    }
}
