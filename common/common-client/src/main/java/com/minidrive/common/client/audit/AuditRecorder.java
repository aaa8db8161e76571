package com.minidrive.common.client.audit;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 감사 로그 전송 (fire-and-forget)
 *
 * <p>감사 로그 실패가 사용자 요청을 실패시키지 않는다. 실패는 warn 로그로만 남긴다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditRecorder {

    private final AuditClient auditClient;

    @CircuitBreaker(name = "auditService", fallbackMethod = "recordFallback")
    public void record(AuditEntry entry) {
        auditClient.log(entry);
    }

    @SuppressWarnings("unused")
    private void recordFallback(AuditEntry entry, Throwable t) {
        log.warn("Audit log dropped: action={}, entityId={}, reason={}",
                entry.action(), entry.entityId(), t.getMessage());
    }
}
