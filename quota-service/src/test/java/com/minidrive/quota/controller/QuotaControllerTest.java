package com.minidrive.quota.controller;

import com.minidrive.common.exception.BusinessException;
import com.minidrive.common.exception.ErrorCode;
import com.minidrive.common.exception.GlobalExceptionHandler;
import com.minidrive.common.security.jwt.JwtTokenProvider;
import com.minidrive.common.web.auth.AuthenticationFilter;
import com.minidrive.common.web.auth.LoginUserArgumentResolver;
import com.minidrive.common.web.auth.SessionVerifier;
import com.minidrive.quota.dto.QuotaResponse;
import com.minidrive.quota.service.QuotaService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class QuotaControllerTest {

    @Mock
    private QuotaService quotaService;

    @InjectMocks
    private QuotaController quotaController;

    @Mock
    private ObjectProvider<SessionVerifier> verifierProvider;

    @Mock
    private SessionVerifier sessionVerifier;

    private final JwtTokenProvider jwtTokenProvider = new JwtTokenProvider(
            "test-signing-secret-with-at-least-32-bytes!!", "MiniDrive.Identity", "MiniDrive",
            Duration.ofHours(12), Duration.ofMinutes(1));

    private MockMvc mockMvc;

    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(quotaController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setCustomArgumentResolvers(new LoginUserArgumentResolver())
                .build();
    }

    @Test
    @DisplayName("GET /api/quota/me - 로그인 사용자의 쿼터")
    void me() throws Exception {
        given(quotaService.getOrCreate(userId)).willReturn(new QuotaResponse(userId, 10, 100, 90, 10.0));

        mockMvc.perform(get("/api/quota/me").requestAttr(AuthenticationFilter.USER_ID_ATTRIBUTE, userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.availableBytes").value(90))
                .andExpect(jsonPath("$.data.usagePercentage").value(10.0));
    }

    @Test
    @DisplayName("GET /api/quota/me - 인증 없으면 401")
    void me_Unauthorized() throws Exception {
        mockMvc.perform(get("/api/quota/me"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("GET /api/quota/{userId}/can-upload")
    void canUpload() throws Exception {
        given(quotaService.canUpload(userId, 2048)).willReturn(true);

        mockMvc.perform(get("/api/quota/{userId}/can-upload", userId).param("fileSize", "2048"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.canUpload").value(true));
    }

    @Test
    @DisplayName("POST /api/quota/{userId}/increase - {success:true}")
    void increase() throws Exception {
        mockMvc.perform(post("/api/quota/{userId}/increase", userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"bytes\":512}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
        verify(quotaService).increase(userId, 512);
    }

    @Test
    @DisplayName("POST /api/quota/{userId}/decrease - 음수면 400")
    void decrease_Negative() throws Exception {
        willThrow(new BusinessException(ErrorCode.NEGATIVE_BYTES)).given(quotaService).decrease(userId, -1);

        mockMvc.perform(post("/api/quota/{userId}/decrease", userId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"bytes\":-1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Bytes cannot be negative."));
    }

    @Test
    @DisplayName("GET /api/quota/me - 로그아웃으로 세션이 삭제된 토큰이면 401")
    void me_RevokedSession_Unauthorized() throws Exception {
        // Given
        Instant now = Instant.now();
        String token = jwtTokenProvider.createToken(userId, "alice@example.com", "session-1", now, now.plusSeconds(600));
        given(verifierProvider.getIfAvailable()).willReturn(sessionVerifier);
        given(sessionVerifier.isActive(eq(token), any())).willReturn(false);
        MockMvc securedMvc = MockMvcBuilders.standaloneSetup(quotaController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setCustomArgumentResolvers(new LoginUserArgumentResolver())
                .addFilters(new AuthenticationFilter(jwtTokenProvider, verifierProvider))
                .build();

        // When & Then
        securedMvc.perform(get("/api/quota/me").header("Authorization", "Bearer " + token))
                .andExpect(status().isUnauthorized());
        verify(quotaService, never()).getOrCreate(any());
    }

    @Test
    @DisplayName("GET /api/quota/me - 세션이 살아있으면 토큰의 사용자로 조회")
    void me_ActiveSession() throws Exception {
        // Given
        Instant now = Instant.now();
        String token = jwtTokenProvider.createToken(userId, "alice@example.com", "session-1", now, now.plusSeconds(600));
        given(verifierProvider.getIfAvailable()).willReturn(sessionVerifier);
        given(sessionVerifier.isActive(eq(token), any())).willReturn(true);
        given(quotaService.getOrCreate(userId)).willReturn(new QuotaResponse(userId, 10, 100, 90, 10.0));
        MockMvc securedMvc = MockMvcBuilders.standaloneSetup(quotaController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setCustomArgumentResolvers(new LoginUserArgumentResolver())
                .addFilters(new AuthenticationFilter(jwtTokenProvider, verifierProvider))
                .build();

        // When & Then
        securedMvc.perform(get("/api/quota/me").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.userId").value(userId.toString()));
    }
}
