package com.minidrive.quota.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;
import java.util.UUID;

/**
 * 사용자별 저장 용량.
 *
 * <p>usedBytes 증감은 {@code QuotaRepository} 의 단일 UPDATE 문으로만 한다
 * (동시 업로드 시 lost update 방지). 한도 변경과 재계산만 엔티티를 통해 수정.</p>
 */
@Entity
@Table(name = "user_quotas", indexes = {
        @Index(name = "idx_quota_user", columnList = "userId", unique = true)
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class UserQuota {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true)
    private UUID userId;

    @Column(nullable = false)
    private long usedBytes;

    @Column(nullable = false)
    private long limitBytes;

    @CreatedDate
    @Column(updatable = false)
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    @Builder
    public UserQuota(UUID userId, long usedBytes, long limitBytes) {
        this.userId = userId;
        this.usedBytes = usedBytes;
        this.limitBytes = limitBytes;
    }

    public long getAvailableBytes() {
        return Math.max(0, limitBytes - usedBytes);
    }

    public double getUsagePercentage() {
        return limitBytes > 0 ? (double) usedBytes / limitBytes * 100 : 0;
    }

    public boolean isExceeded() {
        return usedBytes > limitBytes;
    }

    public boolean canStore(long bytes) {
        return bytes <= limitBytes - usedBytes;
    }

    public void changeLimit(long limitBytes) {
        this.limitBytes = limitBytes;
    }

    public void syncUsed(long usedBytes) {
        this.usedBytes = usedBytes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UserQuota other)) return false;
        return id != null && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
