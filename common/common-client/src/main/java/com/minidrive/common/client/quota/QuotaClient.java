package com.minidrive.common.client.quota;

import com.minidrive.common.dto.ApiResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.UUID;

/** Quota 서비스 내부 API */
@FeignClient(name = "quota-service", url = "${quota-service.url:http://localhost:8084}")
public interface QuotaClient {

    @GetMapping("/api/quota/{userId}")
    ApiResponse<QuotaView> getQuota(@PathVariable("userId") UUID userId);

    @GetMapping("/api/quota/{userId}/can-upload")
    ApiResponse<CanUploadView> canUpload(@PathVariable("userId") UUID userId,
                                         @RequestParam("fileSize") long fileSize);

    @PostMapping("/api/quota/{userId}/increase")
    ApiResponse<Void> increase(@PathVariable("userId") UUID userId, @RequestBody BytesRequest request);

    @PostMapping("/api/quota/{userId}/decrease")
    ApiResponse<Void> decrease(@PathVariable("userId") UUID userId, @RequestBody BytesRequest request);

    record QuotaView(UUID userId, long usedBytes, long limitBytes, long availableBytes, double usagePercentage) {}

    record CanUploadView(boolean canUpload) {}

    record BytesRequest(long bytes) {}
}
