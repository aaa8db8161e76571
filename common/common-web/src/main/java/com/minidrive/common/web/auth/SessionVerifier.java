package com.minidrive.common.web.auth;

import com.minidrive.common.security.jwt.SessionClaims;

/**
 * 서버 측 세션 확인 (Session Verifier)
 *
 * <p>JWT 서명이 유효해도 로그아웃으로 세션이 삭제되었을 수 있다.
 * 빈이 등록된 서비스에서는 {@link AuthenticationFilter} 가 이 검사까지 통과해야 인증된 요청으로 본다.</p>
 */
public interface SessionVerifier {

    boolean isActive(String accessToken, SessionClaims claims);
}
