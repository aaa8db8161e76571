package com.minidrive.sharing.controller;

import com.minidrive.common.dto.ApiResponse;
import com.minidrive.common.web.auth.AuthenticationFilter;
import com.minidrive.common.web.auth.LoginUser;
import com.minidrive.sharing.dto.AccessShareRequest;
import com.minidrive.sharing.dto.CreateShareRequest;
import com.minidrive.sharing.dto.ShareResponse;
import com.minidrive.sharing.dto.UpdateShareRequest;
import com.minidrive.sharing.service.ShareService;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * 공유 API. /public/** 는 익명 접근 가능.
 */
@RestController
@RequestMapping("/api/shares")
@RequiredArgsConstructor
public class ShareController {

    private final ShareService shareService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<ShareResponse> create(
            @LoginUser UUID userId,
            @RequestAttribute(name = AuthenticationFilter.ACCESS_TOKEN_ATTRIBUTE, required = false) String accessToken,
            @RequestBody CreateShareRequest request) {
        return ApiResponse.ok(shareService.create(userId, accessToken, request));
    }

    @GetMapping("/{id}")
    public ApiResponse<ShareResponse> getShare(@LoginUser UUID userId, @PathVariable UUID id) {
        return ApiResponse.ok(shareService.getShare(id, userId));
    }

    @GetMapping("/my-shares")
    public ApiResponse<List<ShareResponse>> myShares(@LoginUser UUID userId) {
        return ApiResponse.ok(shareService.myShares(userId));
    }

    @GetMapping("/shared-with-me")
    public ApiResponse<List<ShareResponse>> sharedWithMe(@LoginUser UUID userId) {
        return ApiResponse.ok(shareService.sharedWithMe(userId));
    }

    @GetMapping("/resource/{resourceId}")
    public ApiResponse<List<ShareResponse>> resourceShares(@LoginUser UUID userId,
                                                           @PathVariable UUID resourceId,
                                                           @RequestParam(defaultValue = "file") String resourceType) {
        return ApiResponse.ok(shareService.resourceShares(resourceId, resourceType, userId));
    }

    @PutMapping("/{id}")
    public ApiResponse<ShareResponse> update(@LoginUser UUID userId, @PathVariable UUID id,
                                             @RequestBody UpdateShareRequest request) {
        return ApiResponse.ok(shareService.update(id, userId, request));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@LoginUser UUID userId, @PathVariable UUID id) {
        shareService.delete(id, userId);
    }

    /** publicShare Rate Limiter: 토큰 추측 시도 완화 */
    @GetMapping("/public/{token}")
    @RateLimiter(name = "publicShare")
    public ApiResponse<ShareResponse> publicShare(@PathVariable String token) {
        return ApiResponse.ok(shareService.getPublicShare(token));
    }

    @PostMapping("/public/{token}/access")
    @RateLimiter(name = "publicShare")
    public ApiResponse<ShareResponse> accessPublicShare(@PathVariable String token,
                                                        @RequestBody(required = false) AccessShareRequest request) {
        return ApiResponse.ok(shareService.accessPublicShare(token, request == null ? null : request.password()));
    }
}
