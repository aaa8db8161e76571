package com.minidrive.folder.dto;

import java.util.UUID;

public record CreateFolderRequest(String name, UUID parentFolderId, String description, String color) {
}
