package com.minidrive.gateway.controller;

import com.minidrive.gateway.health.AggregateHealth;
import com.minidrive.gateway.health.DownstreamHealthChecker;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gateway 헬스 체크. 둘 다 인증 없이 호출된다.
 */
@RestController
@RequiredArgsConstructor
public class GatewayHealthController {

    private final DownstreamHealthChecker healthChecker;

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", "gateway");
        body.put("timestamp", Instant.now().toString());
        return body;
    }

    /**
     * 모든 하위 서비스가 healthy 면 200, 아니면 503 (degraded).
     */
    @GetMapping("/health/aggregate")
    public Mono<ResponseEntity<AggregateHealth>> aggregate() {
        return healthChecker.checkAll()
                .map(health -> ResponseEntity
                        .status(health.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                        .body(health));
    }
}
