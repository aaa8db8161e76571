package com.minidrive.folder.dto;

import java.util.UUID;

/** null 필드는 변경하지 않는다 */
public record UpdateFolderRequest(String name, String description, String color, UUID parentFolderId) {
}
