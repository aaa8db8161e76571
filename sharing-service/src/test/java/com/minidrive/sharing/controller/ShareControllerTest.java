package com.minidrive.sharing.controller;

import com.minidrive.common.exception.BusinessException;
import com.minidrive.common.exception.ErrorCode;
import com.minidrive.common.exception.GlobalExceptionHandler;
import com.minidrive.common.web.auth.AuthenticationFilter;
import com.minidrive.common.web.auth.LoginUserArgumentResolver;
import com.minidrive.sharing.dto.CreateShareRequest;
import com.minidrive.sharing.dto.ShareResponse;
import com.minidrive.sharing.service.ShareService;
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

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ShareControllerTest {

    @Mock
    private ShareService shareService;

    @InjectMocks
    private ShareController shareController;

    private MockMvc mockMvc;

    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(shareController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setCustomArgumentResolvers(new LoginUserArgumentResolver())
                .build();
    }

    private ShareResponse share(boolean publicShare, String token) {
        return new ShareResponse(UUID.randomUUID(), UUID.randomUUID(), "file", userId, null, "view",
                publicShare, token, true, null, false, null, 0, null, null, null);
    }

    @Test
    @DisplayName("POST /api/shares - 호출자 토큰을 함께 넘기고 201")
    void create_Returns201() throws Exception {
        given(shareService.create(eq(userId), eq("jwt"), any(CreateShareRequest.class)))
                .willReturn(share(true, "tok"));

        mockMvc.perform(post("/api/shares")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resourceId\":\"" + UUID.randomUUID() + "\",\"resourceType\":\"file\",\"publicShare\":true}")
                        .requestAttr(AuthenticationFilter.USER_ID_ATTRIBUTE, userId)
                        .requestAttr(AuthenticationFilter.ACCESS_TOKEN_ATTRIBUTE, "jwt"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.shareToken").value("tok"));
    }

    @Test
    @DisplayName("POST /api/shares - 인증 없으면 401")
    void create_Unauthorized() throws Exception {
        mockMvc.perform(post("/api/shares")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isUnauthorized());
        verifyNoInteractions(shareService);
    }

    @Test
    @DisplayName("GET /api/shares/shared-with-me")
    void sharedWithMe() throws Exception {
        given(shareService.sharedWithMe(userId)).willReturn(List.of(share(false, null)));

        mockMvc.perform(get("/api/shares/shared-with-me").requestAttr(AuthenticationFilter.USER_ID_ATTRIBUTE, userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].permission").value("view"));
    }

    @Test
    @DisplayName("GET /api/shares/public/{token} - 익명 접근, 만료 시 410")
    void publicShare_Expired() throws Exception {
        given(shareService.getPublicShare("tok")).willThrow(new BusinessException(ErrorCode.SHARE_EXPIRED));

        mockMvc.perform(get("/api/shares/public/{token}", "tok"))
                .andExpect(status().isGone())
                .andExpect(jsonPath("$.detail").value("Share has expired."));
    }

    @Test
    @DisplayName("POST /api/shares/public/{token}/access - 비밀번호 불일치 401")
    void access_InvalidPassword() throws Exception {
        given(shareService.accessPublicShare("tok", "bad"))
                .willThrow(new BusinessException(ErrorCode.INVALID_SHARE_PASSWORD));

        mockMvc.perform(post("/api/shares/public/{token}/access", "tok")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"password\":\"bad\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Invalid password."));
    }

    @Test
    @DisplayName("POST /api/shares/public/{token}/access - 본문 없이도 접근")
    void access_WithoutBody() throws Exception {
        given(shareService.accessPublicShare("tok", null)).willReturn(share(true, "tok"));

        mockMvc.perform(post("/api/shares/public/{token}/access", "tok"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
    }
}
