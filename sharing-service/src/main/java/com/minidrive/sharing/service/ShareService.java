package com.minidrive.sharing.service;

import com.minidrive.common.exception.BusinessException;
import com.minidrive.common.exception.ErrorCode;
import com.minidrive.common.security.crypto.PasswordHasher;
import com.minidrive.sharing.client.ResourceOwnershipVerifier;
import com.minidrive.sharing.dto.CreateShareRequest;
import com.minidrive.sharing.dto.ShareResponse;
import com.minidrive.sharing.dto.UpdateShareRequest;
import com.minidrive.sharing.entity.Share;
import com.minidrive.sharing.repository.ShareRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * 공유 서비스 (Share Service)
 *
 * <h3>공개 링크 접근 흐름</h3>
 * <pre>
 *   1. token 으로 활성 공유 조회          → 없으면 404
 *   2. 만료 확인 (만료 시 비활성화 저장)   → 410
 *   3. 다운로드 한도 확인                  → 410
 *   4. (access) 비밀번호 확인              → 401
 *   5. (access) 다운로드 횟수 원자적 증가
 * </pre>
 *
 * <p>만료 시 비활성화는 예외와 함께 커밋되어야 하므로 공개 조회 메서드는
 * BusinessException 으로 롤백하지 않는다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ShareService {

    private static final Set<String> RESOURCE_TYPES = Set.of(Share.TYPE_FILE, Share.TYPE_FOLDER);
    private static final Set<String> PERMISSIONS = Set.of("view", "edit", "admin");

    private final ShareRepository shareRepository;
    private final ResourceOwnershipVerifier ownershipVerifier;
    private final ShareTokenGenerator tokenGenerator;
    private final PasswordHasher passwordHasher;

    @Transactional
    public ShareResponse create(UUID ownerId, String accessToken, CreateShareRequest request) {
        if (request.resourceId() == null) {
            throw invalid("Resource ID cannot be empty.");
        }
        if (request.resourceType() == null || request.resourceType().isBlank()) {
            throw invalid("Resource type is required.");
        }
        String resourceType = request.resourceType().trim().toLowerCase(Locale.ROOT);
        if (!RESOURCE_TYPES.contains(resourceType)) {
            throw invalid("Resource type must be 'file' or 'folder'.");
        }
        String permission = request.permission() == null ? Share.PERMISSION_VIEW : normalizePermission(request.permission());
        if (!request.publicShare() && request.sharedWithUserId() == null) {
            throw invalid("SharedWithUserId is required for non-public shares.");
        }
        if (ownerId.equals(request.sharedWithUserId())) {
            throw invalid("Cannot share a resource with yourself.");
        }
        validateMaxDownloads(request.maxDownloads());

        boolean owned = Share.TYPE_FOLDER.equals(resourceType)
                ? ownershipVerifier.ownsFolder(request.resourceId(), accessToken)
                : ownershipVerifier.ownsFile(request.resourceId(), accessToken);
        if (!owned) {
            throw new BusinessException(ErrorCode.RESOURCE_NOT_FOUND);
        }

        if (request.sharedWithUserId() != null
                && shareRepository.existsByResourceIdAndResourceTypeAndSharedWithUserIdAndActiveTrueAndDeletedFalse(
                request.resourceId(), resourceType, request.sharedWithUserId())) {
            throw new BusinessException(ErrorCode.DUPLICATE_SHARE);
        }

        Share share = Share.builder()
                .resourceId(request.resourceId())
                .resourceType(resourceType)
                .ownerId(ownerId)
                .sharedWithUserId(request.sharedWithUserId())
                .permission(permission)
                .publicShare(request.publicShare())
                .shareToken(request.publicShare() ? tokenGenerator.generate() : null)
                .expiresAt(request.expiresAt())
                .maxDownloads(request.maxDownloads())
                .notes(request.notes())
                .build();
        if (request.password() != null && !request.password().isEmpty()) {
            PasswordHasher.HashedPassword hashed = passwordHasher.hash(request.password());
            share.protectWith(hashed.hash(), hashed.salt());
        }

        Share saved = shareRepository.save(share);
        log.info("Share created: shareId={}, resource={}:{}, ownerId={}, public={}",
                saved.getId(), resourceType, saved.getResourceId(), ownerId, saved.isPublicShare());
        return ShareResponse.from(saved);
    }

    public ShareResponse getShare(UUID shareId, UUID ownerId) {
        return ShareResponse.from(findOwned(shareId, ownerId));
    }

    public List<ShareResponse> myShares(UUID ownerId) {
        return shareRepository.findByOwnerIdAndDeletedFalseOrderByCreatedAtDesc(ownerId).stream()
                .map(ShareResponse::from)
                .toList();
    }

    public List<ShareResponse> sharedWithMe(UUID userId) {
        return shareRepository.findBySharedWithUserIdAndActiveTrueAndDeletedFalseOrderByCreatedAtDesc(userId).stream()
                .map(ShareResponse::from)
                .toList();
    }

    /** 리소스에 걸린 공유 중 호출자가 만든 것만 */
    public List<ShareResponse> resourceShares(UUID resourceId, String resourceType, UUID ownerId) {
        String type = resourceType == null ? Share.TYPE_FILE : resourceType.trim().toLowerCase(Locale.ROOT);
        return shareRepository.findByResourceIdAndResourceTypeAndOwnerIdAndDeletedFalseOrderByCreatedAtDesc(
                        resourceId, type, ownerId).stream()
                .map(ShareResponse::from)
                .toList();
    }

    @Transactional
    public ShareResponse update(UUID shareId, UUID ownerId, UpdateShareRequest request) {
        Share share = findOwned(shareId, ownerId);

        if (request.permission() != null && !request.permission().isEmpty()) {
            share.changePermission(normalizePermission(request.permission()));
        }
        if (request.expiresAt() != null) {
            share.changeExpiry(request.expiresAt());
        }
        if (request.active() != null) {
            share.changeActive(request.active());
        }
        if (request.password() != null) {
            if (request.password().isEmpty()) {
                share.removePassword();
            } else {
                PasswordHasher.HashedPassword hashed = passwordHasher.hash(request.password());
                share.protectWith(hashed.hash(), hashed.salt());
            }
        }
        if (request.maxDownloads() != null) {
            validateMaxDownloads(request.maxDownloads());
            share.changeMaxDownloads(request.maxDownloads());
        }
        if (request.notes() != null) {
            share.changeNotes(request.notes());
        }

        log.info("Share updated: shareId={}, ownerId={}", shareId, ownerId);
        return ShareResponse.from(share);
    }

    @Transactional
    public void delete(UUID shareId, UUID ownerId) {
        findOwned(shareId, ownerId).markDeleted(Instant.now());
        log.info("Share deleted: shareId={}, ownerId={}", shareId, ownerId);
    }

    /** 공개 링크 메타데이터 (익명) */
    @Transactional(noRollbackFor = BusinessException.class)
    public ShareResponse getPublicShare(String token) {
        return ShareResponse.from(findUsablePublicShare(token));
    }

    /**
     * 공개 링크 접근 (익명). 비밀번호 확인 후 다운로드 횟수를 올린다.
     */
    @Transactional(noRollbackFor = BusinessException.class)
    public ShareResponse accessPublicShare(String token, String password) {
        Share share = findUsablePublicShare(token);

        if (share.hasPassword()
                && !passwordHasher.verify(password, share.getPasswordHash(), share.getPasswordSalt())) {
            log.warn("Invalid password for public share: shareId={}", share.getId());
            throw new BusinessException(ErrorCode.INVALID_SHARE_PASSWORD);
        }

        UUID shareId = share.getId();
        if (shareRepository.incrementDownloads(shareId) == 0) {
            throw new BusinessException(ErrorCode.SHARE_DOWNLOAD_LIMIT_REACHED);
        }

        Share refreshed = shareRepository.findById(shareId)
                .orElseThrow(() -> new BusinessException(ErrorCode.PUBLIC_SHARE_NOT_FOUND));
        log.info("Public share accessed: shareId={}, downloads={}", shareId, refreshed.getCurrentDownloads());
        return ShareResponse.from(refreshed);
    }

    private Share findUsablePublicShare(String token) {
        Share share = shareRepository.findByShareTokenAndActiveTrueAndDeletedFalse(token)
                .orElseThrow(() -> new BusinessException(ErrorCode.PUBLIC_SHARE_NOT_FOUND));

        if (share.isExpired(Instant.now())) {
            share.deactivate();
            log.info("Public share expired and deactivated: shareId={}", share.getId());
            throw new BusinessException(ErrorCode.SHARE_EXPIRED);
        }
        if (share.isDownloadLimitReached()) {
            throw new BusinessException(ErrorCode.SHARE_DOWNLOAD_LIMIT_REACHED);
        }
        return share;
    }

    private Share findOwned(UUID shareId, UUID ownerId) {
        Share share = shareRepository.findByIdAndDeletedFalse(shareId)
                .orElseThrow(() -> new BusinessException(ErrorCode.SHARE_NOT_FOUND));
        if (!share.isOwnedBy(ownerId)) {
            throw new BusinessException(ErrorCode.SHARE_ACCESS_DENIED);
        }
        return share;
    }

    private static String normalizePermission(String permission) {
        String normalized = permission.trim().toLowerCase(Locale.ROOT);
        if (!PERMISSIONS.contains(normalized)) {
            throw invalid("Permission must be 'view', 'edit', or 'admin'.");
        }
        return normalized;
    }

    private static void validateMaxDownloads(Integer maxDownloads) {
        if (maxDownloads != null && maxDownloads < 1) {
            throw invalid("Max downloads must be at least 1.");
        }
    }

    private static BusinessException invalid(String message) {
        return new BusinessException(ErrorCode.INVALID_SHARE_REQUEST, message);
    }
}
