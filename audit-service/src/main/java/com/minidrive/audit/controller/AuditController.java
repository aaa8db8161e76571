package com.minidrive.audit.controller;

import com.minidrive.audit.dto.AuditLogResponse;
import com.minidrive.audit.dto.LogAuditRequest;
import com.minidrive.audit.service.AuditService;
import com.minidrive.common.dto.ApiResponse;
import com.minidrive.common.web.auth.LoginUser;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * 감사 로그 API. POST /log 와 조회 API 는 내부용, /me 만 Gateway 로 노출된다.
 */
@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditService auditService;

    @PostMapping("/log")
    public ApiResponse<Void> log(@RequestBody LogAuditRequest request) {
        auditService.log(request);
        return ApiResponse.ok(null);
    }

    @GetMapping("/me")
    public ApiResponse<List<AuditLogResponse>> me(
            @LoginUser UUID userId,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return ApiResponse.ok(auditService.userLogs(userId, limit, from, to));
    }

    @GetMapping("/users/{userId}")
    public ApiResponse<List<AuditLogResponse>> userLogs(
            @PathVariable UUID userId,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return ApiResponse.ok(auditService.userLogs(userId, limit, from, to));
    }

    @GetMapping("/entities/{entityType}/{entityId}")
    public ApiResponse<List<AuditLogResponse>> entityLogs(@PathVariable String entityType,
                                                          @PathVariable String entityId,
                                                          @RequestParam(required = false) Integer limit) {
        return ApiResponse.ok(auditService.entityLogs(entityType, entityId, limit));
    }

    @GetMapping("/actions/{action}")
    public ApiResponse<List<AuditLogResponse>> actionLogs(
            @PathVariable String action,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return ApiResponse.ok(auditService.actionLogs(action, limit, from, to));
    }
}
