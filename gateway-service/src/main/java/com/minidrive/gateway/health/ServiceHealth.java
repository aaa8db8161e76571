package com.minidrive.gateway.health;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 하위 서비스 한 곳의 /health 결과. 응답을 받았으면 statusCode, 연결 자체가 실패했으면 error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServiceHealth(String status, Integer statusCode, String error) {

    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";

    public static ServiceHealth fromStatusCode(int statusCode) {
        boolean success = statusCode >= 200 && statusCode < 300;
        return new ServiceHealth(success ? HEALTHY : UNHEALTHY, statusCode, null);
    }

    public static ServiceHealth unreachable(String error) {
        return new ServiceHealth(UNHEALTHY, null, error);
    }

    @JsonIgnore
    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
