package com.minidrive.common.web.auth;

import com.minidrive.common.security.jwt.JwtTokenProvider;
import com.minidrive.common.security.jwt.SessionClaims;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AuthenticationFilterTest {

    @Mock
    private JwtTokenProvider jwtTokenProvider;
    @Mock
    private ObjectProvider<SessionVerifier> verifierProvider;
    @Mock
    private SessionVerifier sessionVerifier;

    private AuthenticationFilter filter;
    private MockHttpServletRequest request;
    private MockFilterChain chain;

    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        filter = new AuthenticationFilter(jwtTokenProvider, verifierProvider);
        request = new MockHttpServletRequest("GET", "/api/files/list");
        chain = new MockFilterChain();
    }

    @Test
    @DisplayName("유효한 토큰 + 활성 세션 - userId 와 accessToken 속성 설정")
    void doFilter_ValidToken_SetsAttributes() throws Exception {
        // Given
        SessionClaims claims = new SessionClaims(userId, "a@b.c", "sid", Instant.now().plusSeconds(60));
        request.addHeader("Authorization", "Bearer good-token");
        given(jwtTokenProvider.parse("good-token")).willReturn(Optional.of(claims));
        given(verifierProvider.getIfAvailable()).willReturn(sessionVerifier);
        given(sessionVerifier.isActive("good-token", claims)).willReturn(true);

        // When
        filter.doFilter(request, new MockHttpServletResponse(), chain);

        // Then
        assertThat(request.getAttribute(AuthenticationFilter.USER_ID_ATTRIBUTE)).isEqualTo(userId);
        assertThat(request.getAttribute(AuthenticationFilter.ACCESS_TOKEN_ATTRIBUTE)).isEqualTo("good-token");
        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    @DisplayName("세션 검증기가 없는 서비스 - JWT 만으로 인증")
    void doFilter_NoVerifier_JwtOnly() throws Exception {
        SessionClaims claims = new SessionClaims(userId, "a@b.c", "sid", Instant.now().plusSeconds(60));
        request.addHeader("Authorization", "good-token");
        given(jwtTokenProvider.parse("good-token")).willReturn(Optional.of(claims));
        given(verifierProvider.getIfAvailable()).willReturn(null);

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(request.getAttribute(AuthenticationFilter.USER_ID_ATTRIBUTE)).isEqualTo(userId);
    }

    @Test
    @DisplayName("세션이 로그아웃된 경우 - 속성 미설정, 요청은 통과")
    void doFilter_RevokedSession_NoAttributes() throws Exception {
        SessionClaims claims = new SessionClaims(userId, "a@b.c", "sid", Instant.now().plusSeconds(60));
        request.addHeader("Authorization", "Bearer revoked");
        given(jwtTokenProvider.parse("revoked")).willReturn(Optional.of(claims));
        given(verifierProvider.getIfAvailable()).willReturn(sessionVerifier);
        given(sessionVerifier.isActive("revoked", claims)).willReturn(false);

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(request.getAttribute(AuthenticationFilter.USER_ID_ATTRIBUTE)).isNull();
        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    @DisplayName("Authorization 헤더 없음 - 토큰 검증 자체를 하지 않음")
    void doFilter_NoHeader_SkipsParsing() throws Exception {
        filter.doFilter(request, new MockHttpServletResponse(), chain);

        verify(jwtTokenProvider, never()).parse(anyString());
        assertThat(request.getAttribute(AuthenticationFilter.USER_ID_ATTRIBUTE)).isNull();
    }
}
