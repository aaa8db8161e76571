package com.minidrive.gateway.health;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Map;

/**
 * /health/aggregate 응답. 하나라도 unhealthy 면 degraded.
 */
public record AggregateHealth(String status, Map<String, ServiceHealth> services, Instant timestamp) {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";

    public static AggregateHealth of(Map<String, ServiceHealth> services) {
        boolean allHealthy = services.values().stream().allMatch(ServiceHealth::isHealthy);
        return new AggregateHealth(allHealthy ? HEALTHY : DEGRADED, services, Instant.now());
    }

    @JsonIgnore
    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
