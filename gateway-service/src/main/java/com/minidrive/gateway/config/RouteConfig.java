package com.minidrive.gateway.config;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cloud.gateway.filter.ratelimit.KeyResolver;
import org.springframework.cloud.gateway.filter.ratelimit.RedisRateLimiter;
import org.springframework.cloud.gateway.route.RouteLocator;
import org.springframework.cloud.gateway.route.builder.GatewayFilterSpec;
import org.springframework.cloud.gateway.route.builder.RouteLocatorBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Gateway 라우트 설정 (프로그래밍 방식)
 *
 * <pre>
 * Client → Gateway(:8080) → [라우트 매칭] → [RateLimiter → CircuitBreaker] → Service(:808x)
 *   /api/auth/**    → identity-service (:8081)
 *   /api/files/**   → file-service     (:8082)
 *   /api/folders/** → folder-service   (:8083)
 *   /api/quota/me   → quota-service    (:8084)
 *   /api/audit/me   → audit-service    (:8085)
 *   /api/shares/**  → sharing-service  (:8086)
 * </pre>
 *
 * <p>quota / audit 는 본인 조회만 외부에 노출한다. 나머지 엔드포인트는 서비스 간 내부 호출용.</p>
 *
 * <p>Circuit Breaker 가 열리면 {@code forward:/fallback} 으로 보내 503 을 돌려준다.
 * 서비스 base URL 은 minidrive.gateway.services 에서 읽는다.</p>
 */
@Configuration
@RequiredArgsConstructor
public class RouteConfig {

    static final String FALLBACK_URI = "forward:/fallback";

    private final GatewayProperties properties;
    private final KeyResolver userKeyResolver;

    @Bean
    public RedisRateLimiter redisRateLimiter(
            @Value("${minidrive.gateway.rate-limit.replenish-rate:20}") int replenishRate,
            @Value("${minidrive.gateway.rate-limit.burst-capacity:40}") int burstCapacity) {
        return new RedisRateLimiter(replenishRate, burstCapacity, 1);
    }

    @Bean
    public RouteLocator miniDriveRoutes(RouteLocatorBuilder builder, RedisRateLimiter redisRateLimiter) {
        return builder.routes()
                .route("identity-service", r -> r
                        .path("/api/auth/**")
                        .filters(f -> protect(f, redisRateLimiter, "identityRoute"))
                        .uri(serviceUrl("identity")))
                .route("file-service", r -> r
                        .path("/api/files/**")
                        .filters(f -> protect(f, redisRateLimiter, "fileRoute"))
                        .uri(serviceUrl("file")))
                .route("folder-service", r -> r
                        .path("/api/folders/**")
                        .filters(f -> protect(f, redisRateLimiter, "folderRoute"))
                        .uri(serviceUrl("folder")))
                .route("sharing-service", r -> r
                        .path("/api/shares/**")
                        .filters(f -> protect(f, redisRateLimiter, "sharingRoute"))
                        .uri(serviceUrl("sharing")))
                .route("quota-service", r -> r
                        .path("/api/quota/me")
                        .filters(f -> protect(f, redisRateLimiter, "quotaRoute"))
                        .uri(serviceUrl("quota")))
                .route("audit-service", r -> r
                        .path("/api/audit/me")
                        .filters(f -> protect(f, redisRateLimiter, "auditRoute"))
                        .uri(serviceUrl("audit")))
                .build();
    }

    private GatewayFilterSpec protect(GatewayFilterSpec filters, RedisRateLimiter rateLimiter, String circuitBreaker) {
        return filters
                .requestRateLimiter(c -> c
                        .setRateLimiter(rateLimiter)
                        .setKeyResolver(userKeyResolver))
                .circuitBreaker(c -> c
                        .setName(circuitBreaker)
                        .setFallbackUri(FALLBACK_URI));
    }

    String serviceUrl(String service) {
        String url = properties.services().get(service);
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("minidrive.gateway.services." + service + " is not configured");
        }
        return url;
    }
}
