package com.minidrive.folder.service;

import com.minidrive.common.dto.PageQuery;
import com.minidrive.common.dto.PagedResult;
import com.minidrive.common.dto.SearchPattern;
import com.minidrive.common.exception.BusinessException;
import com.minidrive.common.exception.ErrorCode;
import com.minidrive.folder.dto.CreateFolderRequest;
import com.minidrive.folder.dto.FolderResponse;
import com.minidrive.folder.dto.UpdateFolderRequest;
import com.minidrive.folder.entity.Folder;
import com.minidrive.folder.repository.FolderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 폴더 서비스 (Folder Service)
 *
 * <h3>트리 불변식</h3>
 * <ul>
 *   <li>같은 부모 안에서 살아있는 폴더 이름은 유일</li>
 *   <li>이동 결과가 순환을 만들 수 없다 (자기 자신 / 자손으로 이동 거부)</li>
 *   <li>하위 폴더가 남아있는 폴더는 삭제 불가</li>
 * </ul>
 *
 * <p>조상 탐색은 최대 {@value #MAX_DEPTH} 단계까지만 따라간다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class FolderService {

    static final int MAX_DEPTH = 100;

    private static final Sort BY_NAME = Sort.by(Sort.Direction.ASC, "name");

    private final FolderRepository folderRepository;

    @Transactional
    public FolderResponse create(UUID ownerId, CreateFolderRequest request) {
        if (request.name() == null || request.name().isBlank()) {
            throw new BusinessException(ErrorCode.FOLDER_NAME_REQUIRED);
        }
        String name = request.name().trim();
        UUID parentId = request.parentFolderId();

        if (parentId != null && folderRepository.findByIdAndOwnerIdAndDeletedFalse(parentId, ownerId).isEmpty()) {
            throw new BusinessException(ErrorCode.PARENT_FOLDER_NOT_FOUND);
        }
        if (folderRepository.findSibling(ownerId, name, parentId).isPresent()) {
            throw new BusinessException(ErrorCode.DUPLICATE_FOLDER_NAME);
        }

        Folder folder = folderRepository.save(Folder.builder()
                .name(name)
                .ownerId(ownerId)
                .parentFolderId(parentId)
                .description(request.description() == null ? null : request.description().trim())
                .color(request.color())
                .build());

        log.info("Folder created: folderId={}, ownerId={}, parentId={}", folder.getId(), ownerId, parentId);
        return FolderResponse.from(folder);
    }

    public FolderResponse getFolder(UUID folderId, UUID ownerId) {
        return FolderResponse.from(findOwned(folderId, ownerId));
    }

    /** 부모(null = 루트) 의 하위 폴더, 이름 오름차순. */
    public PagedResult<FolderResponse> list(UUID ownerId, UUID parentFolderId, String search, PageQuery pageQuery) {
        Pageable pageable = pageQuery.toPageable(BY_NAME);
        Page<Folder> page;
        if (search != null && !search.isBlank()) {
            String pattern = SearchPattern.contains(search);
            page = parentFolderId == null
                    ? folderRepository.searchInRoot(ownerId, pattern, pageable)
                    : folderRepository.searchInParent(ownerId, parentFolderId, pattern, pageable);
        } else {
            page = parentFolderId == null
                    ? folderRepository.findByOwnerIdAndParentFolderIdIsNullAndDeletedFalse(ownerId, pageable)
                    : folderRepository.findByOwnerIdAndParentFolderIdAndDeletedFalse(ownerId, parentFolderId, pageable);
        }
        return PagedResult.from(page).map(FolderResponse::from);
    }

    /**
     * 루트부터 해당 폴더까지의 경로 (breadcrumb).
     * 중간 조상이 없거나 삭제되었으면 거기서 멈춘다. 폴더 자체가 없으면 빈 목록.
     */
    public List<FolderResponse> path(UUID folderId, UUID ownerId) {
        LinkedList<FolderResponse> path = new LinkedList<>();
        UUID currentId = folderId;
        int depth = 0;
        while (currentId != null && depth < MAX_DEPTH) {
            Optional<Folder> folder = folderRepository.findByIdAndOwnerIdAndDeletedFalse(currentId, ownerId);
            if (folder.isEmpty()) {
                break;
            }
            path.addFirst(FolderResponse.from(folder.get()));
            currentId = folder.get().getParentFolderId();
            depth++;
        }
        return new ArrayList<>(path);
    }

    @Transactional
    public FolderResponse update(UUID folderId, UUID ownerId, UpdateFolderRequest request) {
        Folder folder = findOwned(folderId, ownerId);
        UUID newParentId = request.parentFolderId();
        boolean renaming = request.name() != null && !request.name().isBlank();

        if (newParentId != null) {
            if (newParentId.equals(folderId)) {
                throw new BusinessException(ErrorCode.FOLDER_MOVE_INTO_SELF);
            }
            if (isDescendant(folderId, newParentId, ownerId)) {
                throw new BusinessException(ErrorCode.FOLDER_MOVE_INTO_DESCENDANT);
            }
            if (folderRepository.findByIdAndOwnerIdAndDeletedFalse(newParentId, ownerId).isEmpty()) {
                throw new BusinessException(ErrorCode.PARENT_FOLDER_NOT_FOUND);
            }
        }

        if (renaming || newParentId != null) {
            String targetName = renaming ? request.name().trim() : folder.getName();
            UUID targetParent = newParentId != null ? newParentId : folder.getParentFolderId();
            folderRepository.findSibling(ownerId, targetName, targetParent)
                    .filter(existing -> !existing.getId().equals(folderId))
                    .ifPresent(existing -> {
                        throw new BusinessException(ErrorCode.DUPLICATE_FOLDER_NAME);
                    });
        }

        if (renaming) {
            folder.rename(request.name().trim());
        }
        if (request.description() != null) {
            folder.changeDescription(request.description().trim());
        }
        if (request.color() != null) {
            folder.changeColor(request.color());
        }
        if (newParentId != null) {
            folder.moveTo(newParentId);
        }

        log.info("Folder updated: folderId={}, ownerId={}", folderId, ownerId);
        return FolderResponse.from(folder);
    }

    @Transactional
    public void delete(UUID folderId, UUID ownerId) {
        Folder folder = findOwned(folderId, ownerId);
        if (folderRepository.existsByOwnerIdAndParentFolderIdAndDeletedFalse(ownerId, folderId)) {
            throw new BusinessException(ErrorCode.FOLDER_NOT_EMPTY);
        }
        folder.markDeleted(Instant.now());
        log.info("Folder deleted: folderId={}, ownerId={}", folderId, ownerId);
    }

    private Folder findOwned(UUID folderId, UUID ownerId) {
        return folderRepository.findByIdAndOwnerIdAndDeletedFalse(folderId, ownerId)
                .orElseThrow(() -> new BusinessException(ErrorCode.FOLDER_NOT_FOUND));
    }

    /** candidateId 에서 조상 방향으로 올라가며 ancestorId 를 만나는지 확인 */
    private boolean isDescendant(UUID ancestorId, UUID candidateId, UUID ownerId) {
        UUID currentId = candidateId;
        int depth = 0;
        while (currentId != null && depth < MAX_DEPTH) {
            if (currentId.equals(ancestorId)) {
                return true;
            }
            Optional<Folder> folder = folderRepository.findByIdAndOwnerIdAndDeletedFalse(currentId, ownerId);
            if (folder.isEmpty()) {
                return false;
            }
            currentId = folder.get().getParentFolderId();
            depth++;
        }
        return false;
    }
}
