package com.minidrive.quota.service;

import com.minidrive.common.exception.BusinessException;
import com.minidrive.common.exception.ErrorCode;
import com.minidrive.quota.config.QuotaProperties;
import com.minidrive.quota.dto.QuotaResponse;
import com.minidrive.quota.entity.UserQuota;
import com.minidrive.quota.repository.QuotaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * 쿼터 서비스 (Quota Service)
 *
 * <pre>
 *   canUpload  : 행이 없으면 기본 한도로 생성 후 판단
 *   increase   : UPDATE used = used + n           (단일 SQL)
 *   decrease   : UPDATE used = max(0, used - n)   (단일 SQL)
 *   limit/sync : 관리용, 행이 없으면 생성
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class QuotaService {

    private final QuotaRepository quotaRepository;
    private final QuotaProperties quotaProperties;

    public QuotaResponse getQuota(UUID userId) {
        return quotaRepository.findByUserId(userId)
                .map(QuotaResponse::from)
                .orElseThrow(() -> new BusinessException(ErrorCode.QUOTA_NOT_FOUND));
    }

    @Transactional
    public QuotaResponse getOrCreate(UUID userId) {
        return QuotaResponse.from(findOrCreate(userId));
    }

    @Transactional
    public boolean canUpload(UUID userId, long fileSize) {
        if (fileSize < 0) {
            return false;
        }
        return findOrCreate(userId).canStore(fileSize);
    }

    @Transactional
    public void increase(UUID userId, long bytes) {
        requireNonNegative(bytes);
        if (quotaRepository.increaseUsed(userId, bytes, Instant.now()) == 0) {
            throw new BusinessException(ErrorCode.QUOTA_NOT_FOUND);
        }
        log.debug("Quota increased: userId={}, bytes={}", userId, bytes);
    }

    @Transactional
    public void decrease(UUID userId, long bytes) {
        requireNonNegative(bytes);
        if (quotaRepository.decreaseUsed(userId, bytes, Instant.now()) == 0) {
            throw new BusinessException(ErrorCode.QUOTA_NOT_FOUND);
        }
        log.debug("Quota decreased: userId={}, bytes={}", userId, bytes);
    }

    @Transactional
    public QuotaResponse updateLimit(UUID userId, long limitBytes) {
        if (limitBytes < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Limit bytes cannot be negative.");
        }
        UserQuota quota = findOrCreate(userId);
        quota.changeLimit(limitBytes);
        log.info("Quota limit changed: userId={}, limitBytes={}", userId, limitBytes);
        return QuotaResponse.from(quota);
    }

    @Transactional
    public QuotaResponse syncUsed(UUID userId, long usedBytes) {
        if (usedBytes < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Used bytes cannot be negative.");
        }
        UserQuota quota = findOrCreate(userId);
        quota.syncUsed(usedBytes);
        log.info("Quota usage synced: userId={}, usedBytes={}", userId, usedBytes);
        return QuotaResponse.from(quota);
    }

    private UserQuota findOrCreate(UUID userId) {
        return quotaRepository.findByUserId(userId).orElseGet(() -> {
            log.info("Creating default quota: userId={}", userId);
            return quotaRepository.save(UserQuota.builder()
                    .userId(userId)
                    .usedBytes(0)
                    .limitBytes(quotaProperties.defaultLimit().toBytes())
                    .build());
        });
    }

    private static void requireNonNegative(long bytes) {
        if (bytes < 0) {
            throw new BusinessException(ErrorCode.NEGATIVE_BYTES);
        }
    }
}
