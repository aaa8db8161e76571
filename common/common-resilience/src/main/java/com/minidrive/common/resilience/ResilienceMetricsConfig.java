package com.minidrive.common.resilience;

import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.micrometer.tagged.TaggedBulkheadMetrics;
import io.github.resilience4j.micrometer.tagged.TaggedCircuitBreakerMetrics;
import io.github.resilience4j.micrometer.tagged.TaggedRateLimiterMetrics;
import io.github.resilience4j.micrometer.tagged.TaggedRetryMetrics;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j 메트릭 등록
 *
 * <p>서비스 간 호출(identityService, quotaService, auditService, fileService, folderService)을
 * 보호하는 Circuit Breaker / Retry 와 API Rate Limiter / Bulkhead 의 상태를
 * /actuator/prometheus 로 노출한다.</p>
 *
 * <pre>
 *   resilience4j_circuitbreaker_state{name="quotaService"}
 *   resilience4j_retry_calls_total{name="identityService", kind="failed_with_retry"}
 *   resilience4j_ratelimiter_available_permissions{name="fileUpload"}
 *   resilience4j_bulkhead_available_concurrent_calls{name="fileUpload"}
 * </pre>
 */
@Configuration
public class ResilienceMetricsConfig {

    public ResilienceMetricsConfig(
            MeterRegistry meterRegistry,
            CircuitBreakerRegistry circuitBreakerRegistry,
            RetryRegistry retryRegistry,
            @SuppressWarnings("SpringJavaInjectionPointsAutowiringInspection")
            RateLimiterRegistry rateLimiterRegistry,
            BulkheadRegistry bulkheadRegistry) {

        TaggedCircuitBreakerMetrics.ofCircuitBreakerRegistry(circuitBreakerRegistry).bindTo(meterRegistry);
        TaggedRetryMetrics.ofRetryRegistry(retryRegistry).bindTo(meterRegistry);
        TaggedRateLimiterMetrics.ofRateLimiterRegistry(rateLimiterRegistry).bindTo(meterRegistry);
        TaggedBulkheadMetrics.ofBulkheadRegistry(bulkheadRegistry).bindTo(meterRegistry);
    }
}
