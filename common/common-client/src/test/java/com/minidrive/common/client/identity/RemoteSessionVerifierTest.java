package com.minidrive.common.client.identity;

import com.minidrive.common.security.jwt.SessionClaims;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RemoteSessionVerifierTest {

    @Mock
    private IdentitySessionLookup identitySessionLookup;
    @Mock
    private RedisTemplate<String, Object> redisTemplate;
    @Mock
    private ValueOperations<String, Object> valueOperations;

    private RemoteSessionVerifier verifier;

    private final UUID userId = UUID.randomUUID();
    private final String token = "header.payload.signature";
    private final String cacheKey = RemoteSessionVerifier.KEY_PREFIX + RemoteSessionVerifier.sha256(token);
    private SessionClaims claims;

    @BeforeEach
    void setUp() {
        verifier = new RemoteSessionVerifier(identitySessionLookup, redisTemplate);
        claims = new SessionClaims(userId, "a@b.c", "sid", Instant.now().plusSeconds(600));
    }

    @Test
    @DisplayName("캐시 hit - Identity 호출 없이 userId 일치 여부로 판단")
    void isActive_CacheHit() {
        // Given
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        given(valueOperations.get(cacheKey)).willReturn(userId.toString());

        // When
        boolean active = verifier.isActive(token, claims);

        // Then
        assertThat(active).isTrue();
        verify(identitySessionLookup, never()).lookup(anyString());
    }

    @Test
    @DisplayName("캐시 miss + 유효한 세션 - 5분 TTL 로 캐시 저장")
    void isActive_CacheMiss_StoresResult() {
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        given(valueOperations.get(cacheKey)).willReturn(null);
        given(identitySessionLookup.lookup(token)).willReturn(Optional.of(
                new IdentityClient.CurrentUser(userId, "a@b.c", "A", true)));

        assertThat(verifier.isActive(token, claims)).isTrue();
        verify(valueOperations).set(cacheKey, userId.toString(), RemoteSessionVerifier.CACHE_TTL);
    }

    @Test
    @DisplayName("로그아웃된 세션 - false, 캐시하지 않음")
    void isActive_Revoked() {
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        given(valueOperations.get(cacheKey)).willReturn(null);
        given(identitySessionLookup.lookup(token)).willReturn(Optional.empty());

        assertThat(verifier.isActive(token, claims)).isFalse();
        verify(valueOperations, never()).set(anyString(), any(), any(java.time.Duration.class));
    }

    @Test
    @DisplayName("토큰의 사용자와 세션의 사용자가 다르면 false")
    void isActive_UserMismatch() {
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        given(valueOperations.get(cacheKey)).willReturn(null);
        given(identitySessionLookup.lookup(token)).willReturn(Optional.of(
                new IdentityClient.CurrentUser(UUID.randomUUID(), "x@b.c", "X", true)));

        assertThat(verifier.isActive(token, claims)).isFalse();
    }

    @Test
    @DisplayName("Redis 장애 - Identity 직접 호출로 대체")
    void isActive_RedisDown_FallsBackToIdentity() {
        given(redisTemplate.opsForValue()).willThrow(new RedisConnectionFailureException("down"));
        given(identitySessionLookup.lookup(token)).willReturn(Optional.of(
                new IdentityClient.CurrentUser(userId, "a@b.c", "A", true)));

        assertThat(verifier.isActive(token, claims)).isTrue();
    }
}
