package com.minidrive.sharing.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;
import java.util.UUID;

/**
 * 공유 (Share)
 *
 * <pre>
 *   사용자 공유 : sharedWithUserId 지정, shareToken 없음
 *   공개 링크   : publicShare = true, shareToken (256-bit base64url) 로 익명 접근
 * </pre>
 *
 * <p>resourceType 은 "file" / "folder", permission 은 "view" / "edit" / "admin" (소문자 저장).
 * currentDownloads 증가는 {@code ShareRepository#incrementDownloads} 의 단일 UPDATE 로만 한다.</p>
 */
@Entity
@Table(name = "shares", indexes = {
        @Index(name = "idx_share_token", columnList = "shareToken", unique = true),
        @Index(name = "idx_share_owner", columnList = "ownerId, deleted"),
        @Index(name = "idx_share_target", columnList = "sharedWithUserId, active, deleted"),
        @Index(name = "idx_share_resource", columnList = "resourceId, resourceType")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Share {

    public static final String TYPE_FILE = "file";
    public static final String TYPE_FOLDER = "folder";
    public static final String PERMISSION_VIEW = "view";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Version
    private Long version;

    @Column(nullable = false)
    private UUID resourceId;

    @Column(nullable = false, length = 16)
    private String resourceType;

    @Column(nullable = false)
    private UUID ownerId;

    private UUID sharedWithUserId;

    @Column(nullable = false, length = 16)
    private String permission;

    @Column(nullable = false)
    private boolean publicShare;

    @Column(unique = true, length = 64)
    private String shareToken;

    @Column(nullable = false)
    private boolean active;

    private Instant expiresAt;

    @Column(nullable = false)
    private boolean deleted;

    private Instant deletedAt;

    @Column(length = 64)
    private String passwordHash;

    @Column(length = 32)
    private String passwordSalt;

    private Integer maxDownloads;

    @Column(nullable = false)
    private int currentDownloads;

    @Column(length = 1000)
    private String notes;

    @CreatedDate
    @Column(updatable = false)
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    @Builder
    public Share(UUID resourceId, String resourceType, UUID ownerId, UUID sharedWithUserId, String permission,
                 boolean publicShare, String shareToken, Instant expiresAt, Integer maxDownloads, String notes) {
        this.resourceId = resourceId;
        this.resourceType = resourceType;
        this.ownerId = ownerId;
        this.sharedWithUserId = sharedWithUserId;
        this.permission = permission;
        this.publicShare = publicShare;
        this.shareToken = shareToken;
        this.expiresAt = expiresAt;
        this.maxDownloads = maxDownloads;
        this.notes = notes;
        this.active = true;
        this.deleted = false;
        this.currentDownloads = 0;
    }

    public boolean isOwnedBy(UUID userId) {
        return ownerId.equals(userId);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }

    public boolean isDownloadLimitReached() {
        return maxDownloads != null && currentDownloads >= maxDownloads;
    }

    public boolean hasPassword() {
        return passwordHash != null;
    }

    public void protectWith(String hash, String salt) {
        this.passwordHash = hash;
        this.passwordSalt = salt;
    }

    public void removePassword() {
        this.passwordHash = null;
        this.passwordSalt = null;
    }

    public void changePermission(String permission) {
        this.permission = permission;
    }

    public void changeExpiry(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public void changeActive(boolean active) {
        this.active = active;
    }

    public void deactivate() {
        this.active = false;
    }

    public void changeMaxDownloads(Integer maxDownloads) {
        this.maxDownloads = maxDownloads;
    }

    public void changeNotes(String notes) {
        this.notes = notes;
    }

    public void markDeleted(Instant at) {
        this.deleted = true;
        this.deletedAt = at;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Share other)) return false;
        return id != null && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
