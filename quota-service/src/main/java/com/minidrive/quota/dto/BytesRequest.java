package com.minidrive.quota.dto;

public record BytesRequest(long bytes) {
}
