package com.minidrive.gateway.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Circuit Breaker Fallback
 *
 * <p>하위 서비스의 Circuit Breaker 가 열리거나 호출이 실패하면 라우트 필터가
 * {@code forward:/fallback} 으로 넘긴다. 원래 요청의 HTTP 메서드가 유지되므로 메서드를 가리지 않는다.</p>
 */
@RestController
public class FallbackController {

    static final int RETRY_AFTER_SECONDS = 30;

    @RequestMapping("/fallback")
    public ResponseEntity<Map<String, Object>> fallback() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("message", "Service is temporarily unavailable. Please try again later.");
        body.put("retryAfter", RETRY_AFTER_SECONDS);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
