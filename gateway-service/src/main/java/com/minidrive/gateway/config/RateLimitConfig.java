package com.minidrive.gateway.config;

import com.minidrive.gateway.filter.JwtAuthGatewayFilter;
import org.springframework.cloud.gateway.filter.ratelimit.KeyResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.publisher.Mono;

import java.net.InetSocketAddress;

/**
 * Redis 기반 분산 Rate Limiting 설정 (Token Bucket)
 *
 * <p>KeyResolver 는 "누구 기준으로 요청 수를 세는가"를 결정한다.
 * replenishRate / burstCapacity 는 라우트별로 application.yml 에서 지정한다.</p>
 *
 * <pre>
 * 클라이언트 → Gateway → [KeyResolver] → [Redis 토큰 확인]
 *                                         ├─ 토큰 있음 → 다운스트림 서비스
 *                                         └─ 토큰 없음 → 429 Too Many Requests
 * </pre>
 */
@Configuration
public class RateLimitConfig {

    static final String ANONYMOUS_KEY = "anonymous";

    /**
     * 로그인 사용자는 X-User-Id 기준, 그 외(로그인/회원가입/공개 공유 링크)는 클라이언트 IP 기준.
     *
     * <p>X-User-Id 는 {@link JwtAuthGatewayFilter} 가 JWT 검증 후에만 설정한다.
     * 클라이언트가 직접 보낸 값은 필터에서 제거된다.</p>
     */
    @Bean
    public KeyResolver userKeyResolver() {
        return exchange -> {
            String userId = exchange.getRequest().getHeaders().getFirst(JwtAuthGatewayFilter.USER_ID_HEADER);
            if (userId != null && !userId.isBlank()) {
                return Mono.just(userId);
            }
            InetSocketAddress remoteAddress = exchange.getRequest().getRemoteAddress();
            if (remoteAddress == null || remoteAddress.getAddress() == null) {
                return Mono.just(ANONYMOUS_KEY);
            }
            return Mono.just(remoteAddress.getAddress().getHostAddress());
        };
    }
}
