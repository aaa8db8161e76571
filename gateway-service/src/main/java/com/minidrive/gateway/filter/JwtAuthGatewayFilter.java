package com.minidrive.gateway.filter;

import com.minidrive.common.security.jwt.JwtTokenProvider;
import com.minidrive.common.security.jwt.SessionClaims;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.cloud.gateway.filter.GlobalFilter;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Gateway 레벨 JWT 인증 필터 (GlobalFilter)
 *
 * <h3>인증 흐름</h3>
 * <pre>
 * 1. 클라이언트가 보낸 X-User-Id 헤더는 무조건 제거 (위조 방지)
 * 2. 공개 경로면 그대로 통과
 * 3. Authorization: Bearer {JWT} 추출 후 서명/만료/발급자 검증
 * 4. 실패 → 401, 성공 → X-User-Id: {userId} 를 붙여 다운스트림으로 전달
 * </pre>
 *
 * <p>서명이 유효한 토큰이라도 로그아웃으로 세션이 삭제되었을 수 있다.
 * 세션 유효성은 각 서비스가 Identity 서비스에 확인한다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthGatewayFilter implements GlobalFilter, Ordered {

    public static final String USER_ID_HEADER = "X-User-Id";

    private static final String BEARER_PREFIX = "Bearer ";

    // 하위 경로까지 모두 공개
    private static final List<String> PUBLIC_PREFIXES = List.of(
            "/health", "/actuator", "/fallback", "/api/shares/public/");

    private static final Set<String> PUBLIC_PATHS = Set.of(
            "/api/auth/register", "/api/auth/login");

    private final JwtTokenProvider jwtTokenProvider;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest().mutate()
                .headers(headers -> headers.remove(USER_ID_HEADER))
                .build();
        ServerWebExchange stripped = exchange.mutate().request(request).build();

        String path = request.getURI().getPath();
        if (isPublic(path)) {
            return chain.filter(stripped);
        }

        Optional<SessionClaims> claims = resolveToken(request.getHeaders())
                .flatMap(jwtTokenProvider::parse);
        if (claims.isEmpty()) {
            log.warn("JWT validation failed for path: {}", path);
            exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
            return exchange.getResponse().setComplete();
        }

        String userId = claims.get().userId().toString();
        log.debug("JWT authenticated: userId={}, path={}", userId, path);

        ServerHttpRequest authenticated = request.mutate()
                .header(USER_ID_HEADER, userId)
                .build();
        return chain.filter(stripped.mutate().request(authenticated).build());
    }

    /**
     * Rate Limiter / Circuit Breaker 보다 먼저 실행되어야 사용자 기준 Rate Limit 이 가능하다.
     */
    @Override
    public int getOrder() {
        return -1;
    }

    static boolean isPublic(String path) {
        return PUBLIC_PATHS.contains(path) || PUBLIC_PREFIXES.stream().anyMatch(path::startsWith);
    }

    private Optional<String> resolveToken(HttpHeaders headers) {
        String bearer = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (bearer == null || bearer.length() <= BEARER_PREFIX.length()
                || !bearer.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return Optional.empty();
        }
        String token = bearer.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
