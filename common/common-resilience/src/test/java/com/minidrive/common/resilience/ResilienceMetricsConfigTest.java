package com.minidrive.common.resilience;

import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResilienceMetricsConfigTest {

    @Test
    @DisplayName("레지스트리에 등록된 Circuit Breaker / Retry 인스턴스가 메트릭으로 노출된다")
    void bindsRegistriesToMeterRegistry() {
        // Given
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        CircuitBreakerRegistry circuitBreakerRegistry = CircuitBreakerRegistry.ofDefaults();
        RetryRegistry retryRegistry = RetryRegistry.ofDefaults();
        circuitBreakerRegistry.circuitBreaker("quotaService");
        retryRegistry.retry("identityService");

        // When
        new ResilienceMetricsConfig(meterRegistry, circuitBreakerRegistry, retryRegistry,
                RateLimiterRegistry.ofDefaults(), BulkheadRegistry.ofDefaults());

        // Then
        assertThat(meterRegistry.find("resilience4j.circuitbreaker.state")
                .tag("name", "quotaService").meters()).isNotEmpty();
        assertThat(meterRegistry.find("resilience4j.retry.calls")
                .tag("name", "identityService").meters()).isNotEmpty();
    }
}
