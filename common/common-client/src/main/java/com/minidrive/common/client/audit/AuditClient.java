package com.minidrive.common.client.audit;

import com.minidrive.common.dto.ApiResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

@FeignClient(name = "audit-service", url = "${audit-service.url:http://localhost:8085}")
public interface AuditClient {

    @PostMapping("/api/audit/log")
    ApiResponse<Void> log(@RequestBody AuditEntry entry);
}
