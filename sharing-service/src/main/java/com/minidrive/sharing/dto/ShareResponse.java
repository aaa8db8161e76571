package com.minidrive.sharing.dto;

import com.minidrive.sharing.entity.Share;

import java.time.Instant;
import java.util.UUID;

/** 비밀번호 해시는 내보내지 않고 hasPassword 만 노출한다. */
public record ShareResponse(
        UUID id,
        UUID resourceId,
        String resourceType,
        UUID ownerId,
        UUID sharedWithUserId,
        String permission,
        boolean publicShare,
        String shareToken,
        boolean active,
        Instant expiresAt,
        boolean hasPassword,
        Integer maxDownloads,
        int currentDownloads,
        String notes,
        Instant createdAt,
        Instant updatedAt
) {
    public static ShareResponse from(Share share) {
        return new ShareResponse(share.getId(), share.getResourceId(), share.getResourceType(), share.getOwnerId(),
                share.getSharedWithUserId(), share.getPermission(), share.isPublicShare(),
                share.isPublicShare() ? share.getShareToken() : null,
                share.isActive(), share.getExpiresAt(), share.hasPassword(), share.getMaxDownloads(),
                share.getCurrentDownloads(), share.getNotes(), share.getCreatedAt(), share.getUpdatedAt());
    }
}
