package com.minidrive.gateway.health;

import com.minidrive.gateway.config.GatewayProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DownstreamHealthCheckerTest {

    private static Map<String, String> services() {
        Map<String, String> services = new LinkedHashMap<>();
        services.put("identity", "http://identity:8081");
        services.put("quota", "http://quota:8084");
        return services;
    }

    private DownstreamHealthChecker checker(ExchangeFunction exchangeFunction, Duration timeout) {
        GatewayProperties properties = new GatewayProperties(services(), timeout, List.of("http://localhost:3000"));
        return new DownstreamHealthChecker(WebClient.builder().exchangeFunction(exchangeFunction), properties);
    }

    @Test
    @DisplayName("모든 서비스가 2xx 면 healthy")
    void allHealthy() {
        // Given
        DownstreamHealthChecker checker = checker(
                request -> Mono.just(ClientResponse.create(HttpStatus.OK).build()), Duration.ofSeconds(3));

        // When & Then
        StepVerifier.create(checker.checkAll())
                .assertNext(health -> {
                    assertThat(health.status()).isEqualTo(AggregateHealth.HEALTHY);
                    assertThat(health.isHealthy()).isTrue();
                    assertThat(health.services()).containsOnlyKeys("identity", "quota");
                    assertThat(health.services().get("identity").statusCode()).isEqualTo(200);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("하나라도 5xx 면 degraded, 상태 코드를 그대로 기록")
    void oneUnhealthy_Degraded() {
        // Given
        DownstreamHealthChecker checker = checker(request -> {
            HttpStatus status = request.url().getHost().equals("quota")
                    ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
            return Mono.just(ClientResponse.create(status).build());
        }, Duration.ofSeconds(3));

        // When & Then
        StepVerifier.create(checker.checkAll())
                .assertNext(health -> {
                    assertThat(health.status()).isEqualTo(AggregateHealth.DEGRADED);
                    assertThat(health.services().get("quota"))
                            .isEqualTo(new ServiceHealth(ServiceHealth.UNHEALTHY, 503, null));
                    assertThat(health.services().get("identity").isHealthy()).isTrue();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("연결 실패는 error 메시지와 함께 unhealthy")
    void connectionFailure_RecordsError() {
        // Given
        DownstreamHealthChecker checker = checker(
                request -> Mono.error(new ConnectException("Connection refused")), Duration.ofSeconds(3));

        // When & Then
        StepVerifier.create(checker.check("identity", "http://identity:8081"))
                .assertNext(health -> {
                    assertThat(health.status()).isEqualTo(ServiceHealth.UNHEALTHY);
                    assertThat(health.statusCode()).isNull();
                    assertThat(health.error()).contains("Connection refused");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("타임아웃을 넘기면 unhealthy")
    void timeout_Unhealthy() {
        // Given
        DownstreamHealthChecker checker = checker(request -> Mono.never(), Duration.ofMillis(50));

        // When & Then
        StepVerifier.create(checker.check("identity", "http://identity:8081"))
                .assertNext(health -> assertThat(health.error()).isEqualTo("Timed out after 50 ms"))
                .verifyComplete();
    }
}
