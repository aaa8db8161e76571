package com.minidrive.identity.controller;

import com.minidrive.common.exception.GlobalExceptionHandler;
import com.minidrive.common.web.request.ClientInfoArgumentResolver;
import com.minidrive.identity.dto.CurrentUserResponse;
import com.minidrive.identity.dto.RegisterResponse;
import com.minidrive.identity.service.AuthService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AuthControllerTest {

    @Mock
    private AuthService authService;

    @InjectMocks
    private AuthController authController;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(authController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setCustomArgumentResolvers(new ClientInfoArgumentResolver())
                .build();
    }

    @Test
    @DisplayName("POST /api/auth/register - 201 과 사용자/세션 반환")
    void register_Returns201() throws Exception {
        UUID userId = UUID.randomUUID();
        given(authService.register(any(), any())).willReturn(new RegisterResponse(
                new RegisterResponse.UserSummary(userId, "a@b.c", "a@b.c", Instant.now()),
                new RegisterResponse.SessionSummary("jwt", Instant.now())));

        mockMvc.perform(post("/api/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"a@b.c\",\"password\":\"pw\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.user.id").value(userId.toString()))
                .andExpect(jsonPath("$.data.session.token").value("jwt"));
    }

    @Test
    @DisplayName("POST /api/auth/logout - Authorization 헤더 없으면 401")
    void logout_MissingHeader_Returns401() throws Exception {
        mockMvc.perform(post("/api/auth/logout"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Missing or invalid Authorization header."));
        verifyNoInteractions(authService);
    }

    @Test
    @DisplayName("POST /api/auth/logout - 성공 시 204, Bearer 접두사 제거 후 전달")
    void logout_Returns204() throws Exception {
        mockMvc.perform(post("/api/auth/logout").header("Authorization", "Bearer jwt"))
                .andExpect(status().isNoContent());
        verify(authService).logout("jwt");
    }

    @Test
    @DisplayName("GET /api/auth/me - 현재 사용자 반환")
    void me_ReturnsCurrentUser() throws Exception {
        UUID userId = UUID.randomUUID();
        given(authService.currentUser("jwt"))
                .willReturn(new CurrentUserResponse(userId, "a@b.c", "Alice", true));

        mockMvc.perform(get("/api/auth/me").header("Authorization", "Bearer jwt"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.email").value("a@b.c"))
                .andExpect(jsonPath("$.data.active").value(true));
    }
}
