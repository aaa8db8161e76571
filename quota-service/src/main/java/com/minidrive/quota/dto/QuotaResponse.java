package com.minidrive.quota.dto;

import com.minidrive.quota.entity.UserQuota;

import java.util.UUID;

public record QuotaResponse(
        UUID userId,
        long usedBytes,
        long limitBytes,
        long availableBytes,
        double usagePercentage
) {
    public static QuotaResponse from(UserQuota quota) {
        return new QuotaResponse(quota.getUserId(), quota.getUsedBytes(), quota.getLimitBytes(),
                quota.getAvailableBytes(), quota.getUsagePercentage());
    }
}
