package com.minidrive.gateway.health;

import com.minidrive.gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeoutException;

/**
 * 하위 서비스 헬스 집계
 *
 * <p>minidrive.gateway.services 에 등록된 모든 서비스의 {@code GET {baseUrl}/health} 를
 * 병렬로 호출한다. 서비스별 타임아웃(기본 3초)을 넘기거나 연결에 실패하면 unhealthy 로 기록하고,
 * 나머지 서비스의 결과는 그대로 모은다.</p>
 */
@Slf4j
@Component
public class DownstreamHealthChecker {

    private final WebClient webClient;
    private final Map<String, String> services;
    private final Duration timeout;

    public DownstreamHealthChecker(WebClient.Builder webClientBuilder, GatewayProperties properties) {
        this.webClient = webClientBuilder.build();
        this.services = properties.services();
        this.timeout = properties.healthCheckTimeout();
    }

    public Mono<AggregateHealth> checkAll() {
        return Flux.fromIterable(services.entrySet())
                .flatMap(service -> check(service.getKey(), service.getValue())
                        .map(health -> Map.entry(service.getKey(), health)))
                .collectMap(Map.Entry::getKey, Map.Entry::getValue, TreeMap::new)
                .map(AggregateHealth::of);
    }

    Mono<ServiceHealth> check(String name, String baseUrl) {
        return webClient.get()
                .uri(baseUrl + "/health")
                .exchangeToMono(response -> response.releaseBody()
                        .thenReturn(ServiceHealth.fromStatusCode(response.statusCode().value())))
                .timeout(timeout)
                .onErrorResume(e -> {
                    String reason = e instanceof TimeoutException
                            ? "Timed out after " + timeout.toMillis() + " ms"
                            : String.valueOf(e.getMessage());
                    log.warn("Health check failed: service={}, reason={}", name, reason);
                    return Mono.just(ServiceHealth.unreachable(reason));
                });
    }
}
