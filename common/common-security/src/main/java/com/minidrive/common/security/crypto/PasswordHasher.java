package com.minidrive.common.security.crypto;

import org.springframework.stereotype.Component;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * 비밀번호 해시 (PBKDF2-HMAC-SHA256)
 *
 * <p>사용자 비밀번호와 공유 링크 비밀번호 모두 이 해시를 사용한다.</p>
 *
 * <pre>
 *   salt       : 16 bytes (SecureRandom)
 *   iterations : 100,000
 *   hash       : 32 bytes
 *   저장 형식  : hex 문자열 (hash, salt 별도 컬럼)
 * </pre>
 */
@Component
public class PasswordHasher {

    private static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final int ITERATIONS = 100_000;
    private static final int SALT_BYTES = 16;
    private static final int HASH_BYTES = 32;
    private static final HexFormat HEX = HexFormat.of();

    private final SecureRandom secureRandom = new SecureRandom();

    public HashedPassword hash(String password) {
        byte[] salt = new byte[SALT_BYTES];
        secureRandom.nextBytes(salt);
        return new HashedPassword(HEX.formatHex(derive(password, salt)), HEX.formatHex(salt));
    }

    /** 고정 시간 비교 (timing attack 방지) */
    public boolean verify(String password, String hashHex, String saltHex) {
        if (password == null || hashHex == null || saltHex == null) {
            return false;
        }
        try {
            byte[] expected = HEX.parseHex(hashHex);
            byte[] actual = derive(password, HEX.parseHex(saltHex));
            return MessageDigest.isEqual(expected, actual);
        } catch (IllegalArgumentException e) {
            return false; // 저장된 값이 hex 가 아님
        }
    }

    private byte[] derive(String password, byte[] salt) {
        PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), salt, ITERATIONS, HASH_BYTES * 8);
        try {
            return SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("PBKDF2 is not available on this JVM", e);
        } finally {
            spec.clearPassword();
        }
    }

    public record HashedPassword(String hash, String salt) {
    }
}
