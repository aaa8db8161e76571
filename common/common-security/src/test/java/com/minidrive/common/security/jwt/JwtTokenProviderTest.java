package com.minidrive.common.security.jwt;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtTokenProviderTest {

    private static final String SECRET = "test-signing-secret-with-at-least-32-bytes!!";

    private final JwtTokenProvider provider = new JwtTokenProvider(
            SECRET, "MiniDrive.Identity", "MiniDrive", Duration.ofHours(12), Duration.ofMinutes(1));

    @Test
    @DisplayName("발급한 토큰을 파싱하면 userId, email, 세션 토큰이 그대로 복원된다")
    void createAndParse_ReturnsClaims() {
        // Given
        UUID userId = UUID.randomUUID();
        Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        String token = provider.createToken(userId, "alice@example.com", "abc123", now, now.plus(Duration.ofHours(1)));

        // When
        Optional<SessionClaims> claims = provider.parse(token);

        // Then
        assertThat(claims).isPresent();
        assertThat(claims.get().userId()).isEqualTo(userId);
        assertThat(claims.get().email()).isEqualTo("alice@example.com");
        assertThat(claims.get().sessionToken()).isEqualTo("abc123");
        assertThat(claims.get().expiresAt()).isEqualTo(now.plus(Duration.ofHours(1)));
    }

    @Test
    @DisplayName("만료된 토큰은 clock skew 를 넘으면 거부")
    void parse_ExpiredToken_Empty() {
        Instant issued = Instant.now().minus(Duration.ofHours(2));
        String token = provider.createToken(UUID.randomUUID(), "a@b.c", "s", issued, issued.plus(Duration.ofHours(1)));

        assertThat(provider.parse(token)).isEmpty();
        assertThat(provider.validateToken(token)).isFalse();
    }

    @Test
    @DisplayName("다른 시크릿으로 서명된 토큰은 거부")
    void parse_ForeignSignature_Empty() {
        JwtTokenProvider other = new JwtTokenProvider(
                "another-signing-secret-with-32-bytes-or-more", "MiniDrive.Identity", "MiniDrive",
                Duration.ofHours(12), Duration.ofMinutes(1));
        Instant now = Instant.now();
        String token = other.createToken(UUID.randomUUID(), "a@b.c", "s", now, now.plusSeconds(600));

        assertThat(provider.parse(token)).isEmpty();
    }

    @Test
    @DisplayName("발급자가 다르면 거부")
    void parse_WrongIssuer_Empty() {
        JwtTokenProvider other = new JwtTokenProvider(
                SECRET, "Someone.Else", "MiniDrive", Duration.ofHours(12), Duration.ofMinutes(1));
        Instant now = Instant.now();
        String token = other.createToken(UUID.randomUUID(), "a@b.c", "s", now, now.plusSeconds(600));

        assertThat(provider.parse(token)).isEmpty();
    }

    @Test
    @DisplayName("빈 값이나 형식이 잘못된 토큰은 예외 없이 empty")
    void parse_Garbage_Empty() {
        assertThat(provider.parse(null)).isEmpty();
        assertThat(provider.parse("  ")).isEmpty();
        assertThat(provider.parse("not-a-jwt")).isEmpty();
    }

    @Test
    @DisplayName("서명 검증 없이 sub 읽기 - 만료된 토큰에서도 사용자 ID 를 얻는다")
    void readSubjectUnverified_ExpiredToken() {
        UUID userId = UUID.randomUUID();
        Instant issued = Instant.now().minus(Duration.ofDays(2));
        String token = provider.createToken(userId, "a@b.c", "s", issued, issued.plus(Duration.ofHours(1)));

        assertThat(provider.readSubjectUnverified(token)).contains(userId);
        assertThat(provider.readSubjectUnverified("9f2c0a")).isEmpty();
    }

    @Test
    @DisplayName("32 바이트 미만 시크릿은 시작 시 거부")
    void constructor_ShortSecret_Throws() {
        assertThatThrownBy(() -> new JwtTokenProvider(
                "short", "MiniDrive.Identity", "MiniDrive", Duration.ofHours(12), Duration.ofMinutes(1)))
                .isInstanceOf(IllegalStateException.class);
    }
}
