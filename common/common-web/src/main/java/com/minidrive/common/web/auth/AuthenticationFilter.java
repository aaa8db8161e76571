package com.minidrive.common.web.auth;

import com.minidrive.common.security.jwt.JwtTokenProvider;
import com.minidrive.common.security.jwt.SessionClaims;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;

/**
 * JWT 인증 필터 (Authentication Filter)
 *
 * <p>Authorization 헤더의 JWT 를 검증하고, 유효하면 userId 를 요청 속성에 설정한다.
 * 컨트롤러는 {@link LoginUser} 파라미터로 이 값을 받는다.</p>
 *
 * <h3>인증 흐름</h3>
 * <pre>
 *   Client → [Authorization: Bearer xxx] → AuthenticationFilter
 *     1. BearerTokens.extract() 로 토큰 추출
 *     2. JwtTokenProvider.parse() 로 서명/만료/발급자 검증
 *     3. SessionVerifier 빈이 있으면 서버 측 세션이 살아있는지 확인
 *     4. request.setAttribute("userId", userId), ("accessToken", token)
 *     5. chain.doFilter()
 * </pre>
 *
 * <p>필터는 요청을 거부하지 않는다. 인증이 필요한 엔드포인트는 {@link LoginUserArgumentResolver} 가 401 로 막는다.</p>
 */
@Slf4j
@Component
public class AuthenticationFilter implements Filter {

    public static final String USER_ID_ATTRIBUTE = "userId";
    public static final String ACCESS_TOKEN_ATTRIBUTE = "accessToken";

    private final JwtTokenProvider jwtTokenProvider;
    private final ObjectProvider<SessionVerifier> sessionVerifier;

    public AuthenticationFilter(JwtTokenProvider jwtTokenProvider,
                                ObjectProvider<SessionVerifier> sessionVerifier) {
        this.jwtTokenProvider = jwtTokenProvider;
        this.sessionVerifier = sessionVerifier;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        HttpServletRequest httpRequest = (HttpServletRequest) request;
        BearerTokens.extract(httpRequest.getHeader(BearerTokens.AUTHORIZATION))
                .ifPresent(token -> authenticate(httpRequest, token));

        chain.doFilter(request, response);
    }

    private void authenticate(HttpServletRequest request, String token) {
        Optional<SessionClaims> claims = jwtTokenProvider.parse(token);
        if (claims.isEmpty()) {
            log.debug("Invalid JWT on {} {}", request.getMethod(), request.getRequestURI());
            return;
        }

        SessionVerifier verifier = sessionVerifier.getIfAvailable();
        if (verifier != null && !verifier.isActive(token, claims.get())) {
            log.debug("Session no longer active: userId={}", claims.get().userId());
            return;
        }

        request.setAttribute(USER_ID_ATTRIBUTE, claims.get().userId());
        request.setAttribute(ACCESS_TOKEN_ATTRIBUTE, token);
    }
}
