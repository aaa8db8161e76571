package com.minidrive.file.dto;

import com.minidrive.file.entity.FileEntry;
import com.minidrive.file.service.FileSizeFormatter;

import java.time.Instant;
import java.util.UUID;

public record FileResponse(
        UUID id,
        String fileName,
        String contentType,
        long sizeBytes,
        String formattedSize,
        String extension,
        String description,
        UUID ownerId,
        UUID folderId,
        Instant createdAt,
        Instant updatedAt
) {
    public static FileResponse from(FileEntry file) {
        return new FileResponse(file.getId(), file.getFileName(), file.getContentType(), file.getSizeBytes(),
                FileSizeFormatter.format(file.getSizeBytes()), file.getExtension(), file.getDescription(),
                file.getOwnerId(), file.getFolderId(), file.getCreatedAt(), file.getUpdatedAt());
    }
}
