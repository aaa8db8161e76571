package com.minidrive.common.client.quota;

import com.minidrive.common.dto.ApiResponse;
import com.minidrive.common.exception.BusinessException;
import com.minidrive.common.exception.ErrorCode;
import feign.FeignException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Quota 서비스 호출 (Retry + Circuit Breaker "quotaService")
 *
 * <ul>
 *   <li>canUpload / increase: 쿼터 서비스 장애 시 업로드를 막는다 (SERVICE_UNAVAILABLE)</li>
 *   <li>decrease: 실패해도 삭제 흐름은 계속된다 (false 반환, warn 로그)</li>
 *   <li>getQuota: 에러 메시지용 부가 정보. 실패 시 empty</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuotaOperations {

    private final QuotaClient quotaClient;

    @Retry(name = "quotaService")
    @CircuitBreaker(name = "quotaService", fallbackMethod = "canUploadFallback")
    public boolean canUpload(UUID userId, long fileSize) {
        ApiResponse<QuotaClient.CanUploadView> response = quotaClient.canUpload(userId, fileSize);
        return response != null && response.data() != null && response.data().canUpload();
    }

    @Retry(name = "quotaService")
    @CircuitBreaker(name = "quotaService", fallbackMethod = "getQuotaFallback")
    public Optional<QuotaClient.QuotaView> getQuota(UUID userId) {
        try {
            return Optional.ofNullable(quotaClient.getQuota(userId)).map(ApiResponse::data);
        } catch (FeignException.NotFound e) {
            return Optional.empty();
        }
    }

    @Retry(name = "quotaService")
    @CircuitBreaker(name = "quotaService", fallbackMethod = "increaseFallback")
    public void increase(UUID userId, long bytes) {
        quotaClient.increase(userId, new QuotaClient.BytesRequest(bytes));
        log.debug("Quota increased: userId={}, bytes={}", userId, bytes);
    }

    @Retry(name = "quotaService")
    @CircuitBreaker(name = "quotaService", fallbackMethod = "decreaseFallback")
    public boolean decrease(UUID userId, long bytes) {
        quotaClient.decrease(userId, new QuotaClient.BytesRequest(bytes));
        log.debug("Quota decreased: userId={}, bytes={}", userId, bytes);
        return true;
    }

    @SuppressWarnings("unused")
    private boolean canUploadFallback(UUID userId, long fileSize, Throwable t) {
        log.warn("Quota check failed for userId={}: {}", userId, t.getMessage());
        throw new BusinessException(ErrorCode.SERVICE_UNAVAILABLE,
                "Quota service is temporarily unavailable. Please try again later.", t);
    }

    @SuppressWarnings("unused")
    private Optional<QuotaClient.QuotaView> getQuotaFallback(UUID userId, Throwable t) {
        log.warn("Quota lookup failed for userId={}: {}", userId, t.getMessage());
        return Optional.empty();
    }

    @SuppressWarnings("unused")
    private void increaseFallback(UUID userId, long bytes, Throwable t) {
        log.warn("Quota increase failed for userId={}, bytes={}: {}", userId, bytes, t.getMessage());
        throw new BusinessException(ErrorCode.SERVICE_UNAVAILABLE,
                "Failed to update storage quota. Please try again later.", t);
    }

    @SuppressWarnings("unused")
    private boolean decreaseFallback(UUID userId, long bytes, Throwable t) {
        log.warn("Quota decrease failed for userId={}, bytes={}: {}", userId, bytes, t.getMessage());
        return false;
    }
}
