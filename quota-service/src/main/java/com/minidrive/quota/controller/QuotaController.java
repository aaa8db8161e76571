package com.minidrive.quota.controller;

import com.minidrive.common.dto.ApiResponse;
import com.minidrive.common.web.auth.LoginUser;
import com.minidrive.quota.dto.*;
import com.minidrive.quota.service.QuotaService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * 쿼터 API. /me 를 제외하면 서비스 간 내부 호출용이며 Gateway 에 노출되지 않는다.
 */
@RestController
@RequestMapping("/api/quota")
@RequiredArgsConstructor
public class QuotaController {

    private final QuotaService quotaService;

    @GetMapping("/me")
    public ApiResponse<QuotaResponse> me(@LoginUser UUID userId) {
        return ApiResponse.ok(quotaService.getOrCreate(userId));
    }

    @GetMapping("/{userId}")
    public ApiResponse<QuotaResponse> getQuota(@PathVariable UUID userId) {
        return ApiResponse.ok(quotaService.getQuota(userId));
    }

    @GetMapping("/{userId}/can-upload")
    public ApiResponse<CanUploadResponse> canUpload(@PathVariable UUID userId, @RequestParam long fileSize) {
        return ApiResponse.ok(new CanUploadResponse(quotaService.canUpload(userId, fileSize)));
    }

    @PostMapping("/{userId}/increase")
    public ApiResponse<Void> increase(@PathVariable UUID userId, @RequestBody BytesRequest request) {
        quotaService.increase(userId, request.bytes());
        return ApiResponse.ok(null);
    }

    @PostMapping("/{userId}/decrease")
    public ApiResponse<Void> decrease(@PathVariable UUID userId, @RequestBody BytesRequest request) {
        quotaService.decrease(userId, request.bytes());
        return ApiResponse.ok(null);
    }

    @PutMapping("/{userId}/limit")
    public ApiResponse<QuotaResponse> updateLimit(@PathVariable UUID userId, @RequestBody LimitRequest request) {
        return ApiResponse.ok(quotaService.updateLimit(userId, request.limitBytes()));
    }

    @PostMapping("/{userId}/sync")
    public ApiResponse<QuotaResponse> sync(@PathVariable UUID userId, @RequestBody SyncRequest request) {
        return ApiResponse.ok(quotaService.syncUsed(userId, request.usedBytes()));
    }
}
