package com.minidrive.identity.entity;

import com.minidrive.common.web.request.ClientInfo;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * 서버 측 세션. 발급된 JWT 의 sid 클레임이 이 테이블의 token 을 가리킨다.
 * 행이 삭제되면(로그아웃) 해당 JWT 도 더 이상 유효하지 않다.
 */
@Entity
@Table(name = "sessions", indexes = {
        @Index(name = "idx_session_user", columnList = "userId"),
        @Index(name = "idx_session_expires", columnList = "expiresAt")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Session {

    @Id
    @Column(length = 64)
    private String token;  // hex(24 random bytes)

    @Column(nullable = false)
    private UUID userId;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant expiresAt;

    @Column(length = ClientInfo.MAX_USER_AGENT_LENGTH)
    private String userAgent;

    @Column(length = ClientInfo.MAX_IP_ADDRESS_LENGTH)
    private String ipAddress;

    @Builder
    public Session(String token, UUID userId, Instant createdAt, Instant expiresAt,
                   String userAgent, String ipAddress) {
        this.token = token;
        this.userId = userId;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.userAgent = userAgent;
        this.ipAddress = ipAddress;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Session other)) return false;
        return token != null && token.equals(other.token);
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
