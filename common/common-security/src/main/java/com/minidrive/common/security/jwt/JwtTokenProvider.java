package com.minidrive.common.security.jwt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

/**
 * JWT 토큰 제공자 (JWT Token Provider)
 *
 * <p>Identity 서비스가 로그인 시 발급하는 액세스 토큰을 생성하고, 모든 서비스와 Gateway 가
 * 같은 시크릿으로 토큰을 검증한다. HMAC-SHA256 서명.</p>
 *
 * <h3>토큰 구조 (JWT Claims)</h3>
 * <pre>
 *   sub   : userId (UUID)
 *   email : 사용자 이메일
 *   sid   : 서버 측 Session 토큰 (로그아웃 시 이 세션이 삭제되면 토큰도 무효)
 *   jti   : 토큰 고유 ID
 *   iss / aud / iat / exp
 * </pre>
 *
 * <p>서명이 유효해도 세션이 삭제되었을 수 있으므로, 최종 유효성은 Identity 서비스의
 * 세션 테이블이 결정한다. 이 클래스는 서명/만료/발급자만 확인한다.</p>
 */
@Slf4j
@Component
public class JwtTokenProvider {

    public static final String CLAIM_EMAIL = "email";
    public static final String CLAIM_SESSION = "sid";

    private static final int MIN_SECRET_BYTES = 32;
    private static final ObjectMapper PAYLOAD_READER = new ObjectMapper();

    private final SecretKey key;
    private final String issuer;
    private final String audience;
    @Getter
    private final Duration accessTokenLifetime;
    private final Duration clockSkew;

    public JwtTokenProvider(
            @Value("${jwt.secret:miniDriveDevelopmentSigningKeyThatIsLongEnough}") String secret,
            @Value("${jwt.issuer:MiniDrive.Identity}") String issuer,
            @Value("${jwt.audience:MiniDrive}") String audience,
            @Value("${jwt.access-token-lifetime:PT12H}") Duration accessTokenLifetime,
            @Value("${jwt.clock-skew:PT1M}") Duration clockSkew) {
        byte[] secretBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (secretBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes long");
        }
        if (accessTokenLifetime.isNegative() || accessTokenLifetime.isZero()) {
            throw new IllegalStateException("jwt.access-token-lifetime must be positive");
        }
        this.key = new SecretKeySpec(secretBytes, "HmacSHA256");
        this.issuer = issuer;
        this.audience = audience;
        this.accessTokenLifetime = accessTokenLifetime;
        this.clockSkew = clockSkew;
    }

    /**
     * 액세스 토큰 생성.
     *
     * @param sessionToken 이 JWT 를 뒷받침하는 서버 측 세션 토큰
     */
    public String createToken(UUID userId, String email, String sessionToken,
                              Instant issuedAt, Instant expiresAt) {
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(userId.toString())
                .issuer(issuer)
                .audience().add(audience).and()
                .claim(CLAIM_EMAIL, email)
                .claim(CLAIM_SESSION, sessionToken)
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .signWith(key)
                .compact();
    }

    /**
     * 서명/발급자/대상/만료를 검증하고 클레임을 꺼낸다.
     * 어느 하나라도 맞지 않으면 empty.
     */
    public Optional<SessionClaims> parse(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .requireIssuer(issuer)
                    .requireAudience(audience)
                    .clockSkewSeconds(clockSkew.toSeconds())
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String sessionToken = claims.get(CLAIM_SESSION, String.class);
            if (claims.getSubject() == null || sessionToken == null) {
                return Optional.empty();
            }
            return Optional.of(new SessionClaims(
                    UUID.fromString(claims.getSubject()),
                    claims.get(CLAIM_EMAIL, String.class),
                    sessionToken,
                    claims.getExpiration().toInstant()));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("JWT rejected: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public boolean validateToken(String token) {
        return parse(token).isPresent();
    }

    /**
     * 서명 검증 없이 payload 의 sub 만 읽는다.
     * "전체 로그아웃" 처럼 만료된 토큰으로도 사용자를 식별해야 하는 경우에만 사용.
     */
    public Optional<UUID> readSubjectUnverified(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String[] parts = token.split("\\.");
        if (parts.length < 2) {
            return Optional.empty();
        }
        try {
            byte[] payload = Base64.getUrlDecoder().decode(parts[1]);
            JsonNode sub = PAYLOAD_READER.readTree(payload).get("sub");
            if (sub == null || !sub.isTextual()) {
                return Optional.empty();
            }
            return Optional.of(UUID.fromString(sub.asText()));
        } catch (IOException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
