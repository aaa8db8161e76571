package com.minidrive.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Gateway 고유 설정 (minidrive.gateway.*)
 *
 * @param services           헬스 집계 대상. 서비스 이름 → base URL
 * @param healthCheckTimeout 하위 서비스 /health 호출 타임아웃
 * @param allowedOrigins     CORS 허용 Origin
 */
@ConfigurationProperties(prefix = "minidrive.gateway")
public record GatewayProperties(
        @DefaultValue Map<String, String> services,
        @DefaultValue("3s") Duration healthCheckTimeout,
        @DefaultValue("http://localhost:3000") List<String> allowedOrigins) {
}
