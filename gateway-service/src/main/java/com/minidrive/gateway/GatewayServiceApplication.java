package com.minidrive.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * MiniDrive Gateway - 모든 외부 요청의 단일 진입점 (Spring Cloud Gateway)
 *
 * <h3>역할</h3>
 * <ul>
 *   <li>경로 기반 라우팅 (identity / file / folder / sharing / quota / audit)</li>
 *   <li>JWT Edge 인증 후 X-User-Id 헤더 전파</li>
 *   <li>Redis 기반 분산 Rate Limiting, Circuit Breaker + Fallback</li>
 *   <li>하위 서비스 헬스 집계 (/health/aggregate)</li>
 * </ul>
 *
 * <p>토큰이 로그아웃으로 폐기되었는지는 Gateway 가 아니라 각 서비스가 세션 검증으로 판단한다.</p>
 *
 * <h3>포트</h3>
 * Gateway: 8080
 */
@SpringBootApplication(scanBasePackages = {
        "com.minidrive.gateway",
        "com.minidrive.common.security"
})
@ConfigurationPropertiesScan
public class GatewayServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayServiceApplication.class, args);
    }
}
