package com.minidrive.sharing.client;

import com.minidrive.common.exception.BusinessException;
import com.minidrive.common.exception.ErrorCode;
import feign.FeignException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * 공유 대상 리소스의 소유권 확인.
 *
 * <p>File / Folder 서비스는 소유자가 아니면 404 를 돌려주므로 2xx 여부만 본다.
 * 서비스 장애(Circuit Open 포함) 시에는 공유를 만들지 않는다 (SERVICE_UNAVAILABLE).</p>
 *
 * <p>Retry / Circuit Breaker 프록시를 거치도록 호출하는 쪽에서 ownsFile / ownsFolder 를 직접 고른다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResourceOwnershipVerifier {

    private final FileResourceClient fileResourceClient;
    private final FolderResourceClient folderResourceClient;

    @Retry(name = "fileService")
    @CircuitBreaker(name = "fileService", fallbackMethod = "ownershipFallback")
    public boolean ownsFile(UUID fileId, String accessToken) {
        try {
            fileResourceClient.getFile(fileId, "Bearer " + accessToken);
            return true;
        } catch (FeignException.NotFound | FeignException.Forbidden | FeignException.Unauthorized e) {
            return false;
        }
    }

    @Retry(name = "folderService")
    @CircuitBreaker(name = "folderService", fallbackMethod = "ownershipFallback")
    public boolean ownsFolder(UUID folderId, String accessToken) {
        try {
            folderResourceClient.getFolder(folderId, "Bearer " + accessToken);
            return true;
        } catch (FeignException.NotFound | FeignException.Forbidden | FeignException.Unauthorized e) {
            return false;
        }
    }

    @SuppressWarnings("unused")
    private boolean ownershipFallback(UUID resourceId, String accessToken, Throwable t) {
        log.warn("Ownership check failed: resourceId={}, cause={}", resourceId, t.getMessage());
        throw new BusinessException(ErrorCode.SERVICE_UNAVAILABLE,
                "Unable to verify resource ownership. Please try again later.", t);
    }
}
