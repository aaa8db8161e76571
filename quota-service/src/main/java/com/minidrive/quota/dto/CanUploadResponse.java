package com.minidrive.quota.dto;

public record CanUploadResponse(boolean canUpload) {
}
