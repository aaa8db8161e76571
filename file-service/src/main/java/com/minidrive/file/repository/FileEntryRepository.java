package com.minidrive.file.repository;

import com.minidrive.file.entity.FileEntry;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

/**
 * 모든 조회는 소유자 기준이며 soft delete 된 행은 제외한다.
 */
public interface FileEntryRepository extends JpaRepository<FileEntry, UUID> {

    Optional<FileEntry> findByIdAndOwnerIdAndDeletedFalse(UUID id, UUID ownerId);

    Page<FileEntry> findByOwnerIdAndFolderIdAndDeletedFalse(UUID ownerId, UUID folderId, Pageable pageable);

    Page<FileEntry> findByOwnerIdAndFolderIdIsNullAndDeletedFalse(UUID ownerId, Pageable pageable);

    /** 이름 또는 설명에 검색어 포함 (대소문자 무시). pattern 은 SearchPattern.contains 로 만든다. */
    @Query("SELECT f FROM FileEntry f WHERE f.ownerId = :ownerId AND f.deleted = false " +
            "AND f.folderId = :folderId " +
            "AND (LOWER(f.fileName) LIKE :pattern ESCAPE '!' OR LOWER(f.description) LIKE :pattern ESCAPE '!')")
    Page<FileEntry> searchInFolder(@Param("ownerId") UUID ownerId,
                                   @Param("folderId") UUID folderId,
                                   @Param("pattern") String pattern,
                                   Pageable pageable);

    @Query("SELECT f FROM FileEntry f WHERE f.ownerId = :ownerId AND f.deleted = false " +
            "AND f.folderId IS NULL " +
            "AND (LOWER(f.fileName) LIKE :pattern ESCAPE '!' OR LOWER(f.description) LIKE :pattern ESCAPE '!')")
    Page<FileEntry> searchInRoot(@Param("ownerId") UUID ownerId,
                                 @Param("pattern") String pattern,
                                 Pageable pageable);

    @Query("SELECT COALESCE(SUM(f.sizeBytes), 0) FROM FileEntry f WHERE f.ownerId = :ownerId AND f.deleted = false")
    long sumSizeByOwner(@Param("ownerId") UUID ownerId);
}
