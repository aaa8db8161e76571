package com.minidrive.file.dto;

import java.util.UUID;

/** null 필드는 변경하지 않는다 */
public record UpdateFileRequest(String fileName, String description, UUID folderId) {
}
