package com.minidrive.quota.dto;

public record LimitRequest(long limitBytes) {
}
