package com.minidrive.identity.controller;

import com.minidrive.common.dto.ApiResponse;
import com.minidrive.common.exception.BusinessException;
import com.minidrive.common.exception.ErrorCode;
import com.minidrive.common.web.auth.BearerTokens;
import com.minidrive.common.web.request.ClientInfo;
import com.minidrive.identity.dto.*;
import com.minidrive.identity.service.AuthService;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    @RateLimiter(name = "authApi")
    public ApiResponse<RegisterResponse> register(@RequestBody RegisterRequest request, ClientInfo client) {
        return ApiResponse.ok(authService.register(request, client));
    }

    /** authApi Rate Limiter: 로그인 브루트포스 완화 */
    @PostMapping("/login")
    @RateLimiter(name = "authApi")
    public ApiResponse<LoginResponse> login(@RequestBody LoginRequest request, ClientInfo client) {
        return ApiResponse.ok(authService.login(request, client));
    }

    @PostMapping("/logout")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void logout(@RequestHeader(value = BearerTokens.AUTHORIZATION, required = false) String authorization) {
        authService.logout(requireToken(authorization));
    }

    @PostMapping("/logout-all")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void logoutAll(@RequestHeader(value = BearerTokens.AUTHORIZATION, required = false) String authorization) {
        authService.logoutAll(requireToken(authorization));
    }

    @GetMapping("/me")
    public ApiResponse<CurrentUserResponse> me(
            @RequestHeader(value = BearerTokens.AUTHORIZATION, required = false) String authorization) {
        return ApiResponse.ok(authService.currentUser(requireToken(authorization)));
    }

    private static String requireToken(String authorization) {
        return BearerTokens.extract(authorization)
                .orElseThrow(() -> new BusinessException(ErrorCode.MISSING_AUTHORIZATION));
    }
}
