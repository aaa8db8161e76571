package com.minidrive.identity.service;

import com.minidrive.common.exception.BusinessException;
import com.minidrive.common.exception.ErrorCode;
import com.minidrive.common.security.crypto.PasswordHasher;
import com.minidrive.common.security.jwt.JwtTokenProvider;
import com.minidrive.common.security.jwt.SessionClaims;
import com.minidrive.common.web.request.ClientInfo;
import com.minidrive.identity.dto.*;
import com.minidrive.identity.entity.Session;
import com.minidrive.identity.entity.User;
import com.minidrive.identity.repository.SessionRepository;
import com.minidrive.identity.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * 인증 서비스 (Authentication Service)
 *
 * <h3>세션 + JWT 이중 구조</h3>
 * <pre>
 *   로그인 → sessions 테이블에 세션 행 저장 (token = hex 24 bytes)
 *         → JWT 발급 (sid 클레임 = 세션 토큰)
 *   요청  → JWT 서명 검증 + sid 세션 행 존재 여부 확인
 *   로그아웃 → 세션 행 삭제 → JWT 가 만료 전이라도 무효
 * </pre>
 *
 * <p>로그인 실패 사유(없는 이메일, 비활성 사용자, 비밀번호 불일치)는 구분하지 않고
 * 모두 "Invalid credentials." 로 응답한다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AuthService {

    private static final int SESSION_TOKEN_BYTES = 24;

    private final UserRepository userRepository;
    private final SessionRepository sessionRepository;
    private final PasswordHasher passwordHasher;
    private final JwtTokenProvider jwtTokenProvider;
    private final SecureRandom secureRandom = new SecureRandom();

    @Transactional
    public RegisterResponse register(RegisterRequest request, ClientInfo client) {
        if (isBlank(request.email()) || isBlank(request.password())) {
            throw new BusinessException(ErrorCode.CREDENTIALS_REQUIRED);
        }

        String email = normalizeEmail(request.email());
        if (userRepository.existsByEmail(email)) {
            throw new BusinessException(ErrorCode.EMAIL_ALREADY_REGISTERED);
        }

        PasswordHasher.HashedPassword hashed = passwordHasher.hash(request.password());
        User user = userRepository.save(User.builder()
                .email(email)
                .displayName(isBlank(request.displayName()) ? email : request.displayName().trim())
                .passwordHash(hashed.hash())
                .passwordSalt(hashed.salt())
                .build());

        IssuedSession issued = openSession(user, client);
        log.info("User registered: userId={}", user.getId());

        return new RegisterResponse(
                new RegisterResponse.UserSummary(user.getId(), user.getEmail(), user.getDisplayName(), user.getCreatedAt()),
                new RegisterResponse.SessionSummary(issued.accessToken(), issued.session().getExpiresAt()));
    }

    @Transactional
    public LoginResponse login(LoginRequest request, ClientInfo client) {
        if (isBlank(request.email()) || isBlank(request.password())) {
            throw new BusinessException(ErrorCode.CREDENTIALS_REQUIRED);
        }

        User user = userRepository.findByEmail(normalizeEmail(request.email()))
                .filter(User::isActive)
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_CREDENTIALS));

        if (!passwordHasher.verify(request.password(), user.getPasswordHash(), user.getPasswordSalt())) {
            log.warn("Login failed: userId={}", user.getId());
            throw new BusinessException(ErrorCode.INVALID_CREDENTIALS);
        }

        user.recordLogin(Instant.now());
        IssuedSession issued = openSession(user, client);
        log.info("User logged in: userId={}", user.getId());

        return new LoginResponse(issued.accessToken(), issued.session().getExpiresAt(),
                new LoginResponse.UserSummary(user.getId(), user.getEmail(), user.getDisplayName(), user.getLastLoginAt()));
    }

    /** 토큰이 가리키는 세션 하나만 삭제 */
    @Transactional
    public void logout(String accessToken) {
        Session session = jwtTokenProvider.parse(accessToken)
                .flatMap(claims -> sessionRepository.findById(claims.sessionToken()))
                .orElseThrow(() -> new BusinessException(ErrorCode.SESSION_NOT_FOUND));

        sessionRepository.delete(session);
        log.info("Session closed: userId={}", session.getUserId());
    }

    /**
     * 사용자의 모든 세션 삭제.
     * 만료된 JWT 로도 호출할 수 있도록 sub 는 서명 검증 없이 읽고,
     * JWT 가 아니면 값 자체를 세션 토큰으로 조회한다.
     */
    @Transactional
    public int logoutAll(String accessToken) {
        UUID userId = jwtTokenProvider.readSubjectUnverified(accessToken)
                .or(() -> sessionRepository.findById(accessToken).map(Session::getUserId))
                .orElseThrow(() -> new BusinessException(ErrorCode.SESSION_NOT_FOUND));

        int removed = sessionRepository.deleteAllByUserId(userId);
        log.info("All sessions closed: userId={}, count={}", userId, removed);
        return removed;
    }

    /**
     * 만료 세션 삭제는 401 응답과 함께 커밋되어야 한다.
     */
    @Transactional(noRollbackFor = BusinessException.class)
    public CurrentUserResponse currentUser(String accessToken) {
        return validateSession(accessToken)
                .map(CurrentUserResponse::from)
                .orElseThrow(() -> new BusinessException(ErrorCode.SESSION_INVALID));
    }

    /**
     * 세션 검증: JWT 서명 → sid 세션 행 → (만료 시 삭제) → sub 일치 → 활성 사용자
     */
    @Transactional
    public Optional<User> validateSession(String accessToken) {
        Optional<SessionClaims> claims = jwtTokenProvider.parse(accessToken);
        if (claims.isEmpty()) {
            return Optional.empty();
        }

        Optional<Session> session = sessionRepository.findById(claims.get().sessionToken());
        if (session.isEmpty()) {
            return Optional.empty();
        }
        if (session.get().isExpired(Instant.now())) {
            sessionRepository.delete(session.get());
            return Optional.empty();
        }
        if (!session.get().getUserId().equals(claims.get().userId())) {
            return Optional.empty();
        }

        return userRepository.findById(session.get().getUserId())
                .filter(User::isActive);
    }

    private IssuedSession openSession(User user, ClientInfo client) {
        Instant now = Instant.now();
        int purged = sessionRepository.deleteExpired(now);
        if (purged > 0) {
            log.debug("Expired sessions purged: {}", purged);
        }

        Session session = sessionRepository.save(Session.builder()
                .token(newSessionToken())
                .userId(user.getId())
                .createdAt(now)
                .expiresAt(now.plus(jwtTokenProvider.getAccessTokenLifetime()))
                .userAgent(client == null ? null : client.userAgent())
                .ipAddress(client == null ? null : client.ipAddress())
                .build());

        String accessToken = jwtTokenProvider.createToken(
                user.getId(), user.getEmail(), session.getToken(), now, session.getExpiresAt());
        return new IssuedSession(session, accessToken);
    }

    private String newSessionToken() {
        byte[] bytes = new byte[SESSION_TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record IssuedSession(Session session, String accessToken) {}
}
