package com.minidrive.common.client.identity;

import com.minidrive.common.security.jwt.SessionClaims;
import com.minidrive.common.web.auth.SessionVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Optional;

/**
 * 원격 세션 검증 (Identity 서비스 + Redis 캐시)
 *
 * <h3>흐름</h3>
 * <pre>
 *   1. Redis 조회: minidrive:identity:token:{sha256(token)}
 *   2. 캐시 hit → userId 일치 여부만 확인
 *   3. 캐시 miss → Identity GET /api/auth/me (Retry + Circuit Breaker)
 *   4. 유효하면 5분간 캐시
 * </pre>
 *
 * <p>로그아웃 후 최대 5분까지는 캐시된 결과로 통과할 수 있다.
 * Redis 장애 시에는 캐시 없이 Identity 를 직접 호출한다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RemoteSessionVerifier implements SessionVerifier {

    static final String KEY_PREFIX = "minidrive:identity:token:";
    static final Duration CACHE_TTL = Duration.ofMinutes(5);

    private final IdentitySessionLookup identitySessionLookup;
    private final RedisTemplate<String, Object> redisTemplate;

    @Override
    public boolean isActive(String accessToken, SessionClaims claims) {
        String key = KEY_PREFIX + sha256(accessToken);
        String expectedUserId = claims.userId().toString();

        Optional<Object> cached = readCache(key);
        if (cached.isPresent()) {
            return expectedUserId.equals(cached.get());
        }

        Optional<IdentityClient.CurrentUser> user = identitySessionLookup.lookup(accessToken);
        if (user.isEmpty() || !user.get().active() || !claims.userId().equals(user.get().id())) {
            return false;
        }
        writeCache(key, expectedUserId);
        return true;
    }

    private Optional<Object> readCache(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (RuntimeException e) {
            log.warn("Session cache read failed, calling identity directly: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String key, String userId) {
        try {
            redisTemplate.opsForValue().set(key, userId, CACHE_TTL);
        } catch (RuntimeException e) {
            log.warn("Session cache write failed: {}", e.getMessage());
        }
    }

    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
