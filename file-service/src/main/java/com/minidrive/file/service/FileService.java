package com.minidrive.file.service;

import com.minidrive.common.client.audit.AuditEntry;
import com.minidrive.common.client.audit.AuditRecorder;
import com.minidrive.common.client.quota.QuotaClient;
import com.minidrive.common.client.quota.QuotaOperations;
import com.minidrive.common.dto.PageQuery;
import com.minidrive.common.dto.PagedResult;
import com.minidrive.common.dto.SearchPattern;
import com.minidrive.common.exception.BusinessException;
import com.minidrive.common.exception.ErrorCode;
import com.minidrive.common.web.request.ClientInfo;
import com.minidrive.file.dto.FileDownload;
import com.minidrive.file.dto.FileResponse;
import com.minidrive.file.dto.StorageUsageResponse;
import com.minidrive.file.dto.UpdateFileRequest;
import com.minidrive.file.entity.FileEntry;
import com.minidrive.file.repository.FileEntryRepository;
import com.minidrive.file.storage.LocalFileStorage;
import com.minidrive.file.validation.FileNameValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * 파일 서비스 (File Service)
 *
 * <h3>업로드 흐름</h3>
 * <pre>
 *   1. 빈 파일 / 이름 / 설명 검증
 *   2. Quota 서비스 canUpload (장애 시 업로드 거부)
 *   3. 디스크 저장 → 메타데이터 저장 → Quota 증가
 *   4. 3 단계 중 하나라도 실패하면 저장한 파일 삭제 + 트랜잭션 롤백
 * </pre>
 *
 * <p>성공/실패 모두 Audit 서비스에 기록한다 (FileUpload, FileDelete, FilePermanentDelete).
 * 감사 로그 전송 실패는 요청 결과에 영향을 주지 않는다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class FileService {

    static final String ACTION_UPLOAD = "FileUpload";
    static final String ACTION_DELETE = "FileDelete";
    static final String ACTION_PERMANENT_DELETE = "FilePermanentDelete";
    private static final String ENTITY_TYPE = "File";

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final FileEntryRepository fileEntryRepository;
    private final LocalFileStorage fileStorage;
    private final QuotaOperations quotaOperations;
    private final AuditRecorder auditRecorder;

    @Transactional
    public FileResponse upload(UUID ownerId, MultipartFile file, UUID folderId, String description,
                               ClientInfo client) {
        String fileName = file == null ? null : file.getOriginalFilename();
        String nameDetail = "File: " + fileName;

        if (file == null || file.isEmpty()) {
            throw uploadFailure(ownerId, nameDetail, new BusinessException(ErrorCode.EMPTY_FILE), client);
        }
        Optional<String> nameError = FileNameValidator.validateFileName(fileName);
        if (nameError.isPresent()) {
            throw uploadFailure(ownerId, nameDetail,
                    new BusinessException(ErrorCode.INVALID_FILE_NAME, nameError.get()), client);
        }
        Optional<String> descriptionError = FileNameValidator.validateDescription(description);
        if (descriptionError.isPresent()) {
            throw uploadFailure(ownerId, nameDetail,
                    new BusinessException(ErrorCode.INVALID_DESCRIPTION, descriptionError.get()), client);
        }

        long size = file.getSize();
        String sizeDetail = nameDetail + ", Size: " + size + " bytes";

        boolean allowed;
        try {
            allowed = quotaOperations.canUpload(ownerId, size);
        } catch (BusinessException e) {
            throw uploadFailure(ownerId, sizeDetail, e, client);
        }
        if (!allowed) {
            String message = quotaOperations.getQuota(ownerId)
                    .map(FileService::quotaExceededMessage)
                    .orElse(ErrorCode.QUOTA_EXCEEDED.getMessage());
            throw uploadFailure(ownerId, sizeDetail, new BusinessException(ErrorCode.QUOTA_EXCEEDED, message), client);
        }

        String storagePath = null;
        try (InputStream content = file.getInputStream()) {
            storagePath = fileStorage.save(content, size, fileName);

            FileEntry entry = fileEntryRepository.save(FileEntry.builder()
                    .fileName(fileName)
                    .contentType(contentTypeOf(file))
                    .sizeBytes(size)
                    .storagePath(storagePath)
                    .ownerId(ownerId)
                    .folderId(folderId)
                    .description(description)
                    .build());

            quotaOperations.increase(ownerId, size);

            auditRecorder.record(AuditEntry.success(ownerId, ACTION_UPLOAD, ENTITY_TYPE, entry.getId().toString(),
                    sizeDetail + ", ContentType: " + entry.getContentType(), client));
            log.info("File uploaded: fileId={}, ownerId={}, size={}", entry.getId(), ownerId, size);
            return FileResponse.from(entry);

        } catch (IOException | RuntimeException e) {
            if (storagePath != null) {
                discardStoredFile(storagePath);
            }
            BusinessException failure = e instanceof BusinessException be ? be
                    : new BusinessException(ErrorCode.UPLOAD_FAILED, "Failed to upload file: " + e.getMessage(), e);
            throw uploadFailure(ownerId, sizeDetail, failure, client);
        }
    }

    public FileResponse getFile(UUID fileId, UUID ownerId) {
        return FileResponse.from(findOwned(fileId, ownerId));
    }

    public FileDownload download(UUID fileId, UUID ownerId) {
        FileEntry file = findOwned(fileId, ownerId);
        return new FileDownload(file, fileStorage.load(file.getStoragePath()));
    }

    /**
     * 폴더(null = 루트) 안의 파일 목록. 검색어가 있으면 이름/설명 부분 일치.
     */
    public PagedResult<FileResponse> list(UUID ownerId, UUID folderId, String search, PageQuery pageQuery) {
        FileNameValidator.validateSearchTerm(search).ifPresent(error -> {
            throw new BusinessException(ErrorCode.INVALID_SEARCH_TERM, error);
        });

        Pageable pageable = pageQuery.toPageable(NEWEST_FIRST);
        Page<FileEntry> page;
        if (search != null && !search.isBlank()) {
            String pattern = SearchPattern.contains(search);
            page = folderId == null
                    ? fileEntryRepository.searchInRoot(ownerId, pattern, pageable)
                    : fileEntryRepository.searchInFolder(ownerId, folderId, pattern, pageable);
        } else {
            page = folderId == null
                    ? fileEntryRepository.findByOwnerIdAndFolderIdIsNullAndDeletedFalse(ownerId, pageable)
                    : fileEntryRepository.findByOwnerIdAndFolderIdAndDeletedFalse(ownerId, folderId, pageable);
        }
        return PagedResult.from(page).map(FileResponse::from);
    }

    @Transactional
    public FileResponse update(UUID fileId, UUID ownerId, UpdateFileRequest request) {
        FileEntry file = findOwned(fileId, ownerId);

        if (request.fileName() != null && !request.fileName().isBlank()) {
            FileNameValidator.validateFileName(request.fileName()).ifPresent(error -> {
                throw new BusinessException(ErrorCode.INVALID_FILE_NAME, error);
            });
            file.rename(request.fileName());
        }
        if (request.description() != null) {
            FileNameValidator.validateDescription(request.description()).ifPresent(error -> {
                throw new BusinessException(ErrorCode.INVALID_DESCRIPTION, error);
            });
            file.changeDescription(request.description());
        }
        if (request.folderId() != null) {
            file.moveTo(request.folderId());
        }
        return FileResponse.from(file);
    }

    /** Soft delete. 쿼터는 영구 삭제 시에만 줄어든다. */
    @Transactional
    public void delete(UUID fileId, UUID ownerId, ClientInfo client) {
        FileEntry file = fileEntryRepository.findByIdAndOwnerIdAndDeletedFalse(fileId, ownerId)
                .orElseThrow(() -> {
                    auditRecorder.record(AuditEntry.failure(ownerId, ACTION_DELETE, ENTITY_TYPE, fileId.toString(),
                            null, ErrorCode.FILE_NOT_FOUND.getMessage(), client));
                    return new BusinessException(ErrorCode.FILE_NOT_FOUND);
                });

        file.markDeleted(Instant.now());
        auditRecorder.record(AuditEntry.success(ownerId, ACTION_DELETE, ENTITY_TYPE, fileId.toString(),
                sizeDetail(file), client));
        log.info("File deleted: fileId={}, ownerId={}", fileId, ownerId);
    }

    /**
     * 영구 삭제: 디스크 파일 → 행 → 쿼터 감소.
     * 디스크 삭제가 실패해도 감사 로그만 남기고 계속 진행한다.
     */
    @Transactional
    public void deletePermanently(UUID fileId, UUID ownerId, ClientInfo client) {
        FileEntry file = fileEntryRepository.findByIdAndOwnerIdAndDeletedFalse(fileId, ownerId)
                .orElseThrow(() -> {
                    auditRecorder.record(AuditEntry.failure(ownerId, ACTION_PERMANENT_DELETE, ENTITY_TYPE,
                            fileId.toString(), null, ErrorCode.FILE_NOT_FOUND.getMessage(), client));
                    return new BusinessException(ErrorCode.FILE_NOT_FOUND);
                });

        try {
            fileStorage.delete(file.getStoragePath());
        } catch (BusinessException e) {
            log.warn("Failed to delete stored file: fileId={}, path={}", fileId, file.getStoragePath(), e);
            auditRecorder.record(AuditEntry.failure(ownerId, ACTION_PERMANENT_DELETE, ENTITY_TYPE, fileId.toString(),
                    "File: " + file.getFileName(), "Failed to delete from storage: " + e.getMessage(), client));
        }

        fileEntryRepository.delete(file);
        if (!quotaOperations.decrease(ownerId, file.getSizeBytes())) {
            log.warn("Quota not decreased after permanent delete: ownerId={}, bytes={}", ownerId, file.getSizeBytes());
        }

        auditRecorder.record(AuditEntry.success(ownerId, ACTION_PERMANENT_DELETE, ENTITY_TYPE, fileId.toString(),
                sizeDetail(file), client));
        log.info("File permanently deleted: fileId={}, ownerId={}", fileId, ownerId);
    }

    public StorageUsageResponse storageUsed(UUID ownerId) {
        long total = fileEntryRepository.sumSizeByOwner(ownerId);
        return new StorageUsageResponse(total, FileSizeFormatter.format(total));
    }

    private FileEntry findOwned(UUID fileId, UUID ownerId) {
        return fileEntryRepository.findByIdAndOwnerIdAndDeletedFalse(fileId, ownerId)
                .orElseThrow(() -> new BusinessException(ErrorCode.FILE_NOT_FOUND));
    }

    private BusinessException uploadFailure(UUID ownerId, String details, BusinessException cause, ClientInfo client) {
        auditRecorder.record(AuditEntry.failure(ownerId, ACTION_UPLOAD, ENTITY_TYPE, AuditEntry.EMPTY_ENTITY_ID,
                details, cause.getMessage(), client));
        log.warn("File upload rejected: ownerId={}, reason={}", ownerId, cause.getMessage());
        return cause;
    }

    private void discardStoredFile(String storagePath) {
        try {
            fileStorage.delete(storagePath);
        } catch (BusinessException e) {
            log.warn("Failed to remove orphaned file: path={}", storagePath, e);
        }
    }

    private static String quotaExceededMessage(QuotaClient.QuotaView quota) {
        return String.format("Storage quota exceeded. Used: %d bytes, Limit: %d bytes, Available: %d bytes",
                quota.usedBytes(), quota.limitBytes(), quota.availableBytes());
    }

    private static String sizeDetail(FileEntry file) {
        return "File: " + file.getFileName() + ", Size: " + file.getSizeBytes() + " bytes";
    }

    private static String contentTypeOf(MultipartFile file) {
        String contentType = file.getContentType();
        return contentType == null || contentType.isBlank() ? "application/octet-stream" : contentType;
    }
}
