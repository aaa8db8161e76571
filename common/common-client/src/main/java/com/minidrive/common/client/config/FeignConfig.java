package com.minidrive.common.client.config;

import feign.Request;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Feign 타임아웃
 *
 * <pre>
 * Gateway:      8s
 *   └─ Feign:   3s connect + 5s read
 * </pre>
 * Retry 3회가 Gateway 타임아웃 안에 끝나지 않을 수 있으므로 Circuit Breaker 가 먼저 차단한다.
 */
@Configuration
public class FeignConfig {

    @Bean
    public Request.Options feignRequestOptions() {
        return new Request.Options(
                3, TimeUnit.SECONDS,   // connectTimeout
                5, TimeUnit.SECONDS,   // readTimeout
                true
        );
    }
}
