package com.minidrive.common.web.health;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 단순 헬스 체크. Gateway 의 /health/aggregate 가 각 서비스의 이 엔드포인트를 호출한다.
 * 상세 상태는 Actuator(/actuator/health) 참고.
 */
@RestController
public class HealthController {

    private final String serviceName;

    public HealthController(@Value("${spring.application.name:minidrive}") String serviceName) {
        this.serviceName = serviceName;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", serviceName);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
