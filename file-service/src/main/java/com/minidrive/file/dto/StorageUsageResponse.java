package com.minidrive.file.dto;

public record StorageUsageResponse(long totalBytes, String formattedSize) {
}
