package com.minidrive.common.client.identity;

import com.minidrive.common.dto.ApiResponse;
import feign.FeignException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Identity 호출부. Retry / Circuit Breaker 프록시가 적용되도록 {@link RemoteSessionVerifier} 와 분리.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdentitySessionLookup {

    private final IdentityClient identityClient;

    /**
     * @return 세션이 유효하면 현재 사용자, 401/404 이면 empty
     */
    @Retry(name = "identityService")
    @CircuitBreaker(name = "identityService", fallbackMethod = "lookupFallback")
    public Optional<IdentityClient.CurrentUser> lookup(String accessToken) {
        try {
            ApiResponse<IdentityClient.CurrentUser> response = identityClient.me("Bearer " + accessToken);
            return Optional.ofNullable(response).map(ApiResponse::data);
        } catch (FeignException.Unauthorized | FeignException.NotFound e) {
            return Optional.empty();
        }
    }

    @SuppressWarnings("unused")
    private Optional<IdentityClient.CurrentUser> lookupFallback(String accessToken, Throwable t) {
        log.warn("Identity service unavailable, treating session as unverified: {}", t.getMessage());
        return Optional.empty();
    }
}
