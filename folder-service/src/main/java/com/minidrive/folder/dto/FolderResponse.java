package com.minidrive.folder.dto;

import com.minidrive.folder.entity.Folder;

import java.time.Instant;
import java.util.UUID;

public record FolderResponse(
        UUID id,
        String name,
        UUID ownerId,
        UUID parentFolderId,
        String description,
        String color,
        Instant createdAt,
        Instant updatedAt
) {
    public static FolderResponse from(Folder folder) {
        return new FolderResponse(folder.getId(), folder.getName(), folder.getOwnerId(),
                folder.getParentFolderId(), folder.getDescription(), folder.getColor(),
                folder.getCreatedAt(), folder.getUpdatedAt());
    }
}
