package com.minidrive.folder.repository;

import com.minidrive.folder.entity.Folder;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

/**
 * 소유자 기준 조회, soft delete 된 폴더는 항상 제외.
 * 루트(parentFolderId = null) 와 특정 부모 조회를 분리한다.
 */
public interface FolderRepository extends JpaRepository<Folder, UUID> {

    Optional<Folder> findByIdAndOwnerIdAndDeletedFalse(UUID id, UUID ownerId);

    Optional<Folder> findFirstByOwnerIdAndNameAndParentFolderIdAndDeletedFalse(UUID ownerId, String name,
                                                                              UUID parentFolderId);

    Optional<Folder> findFirstByOwnerIdAndNameAndParentFolderIdIsNullAndDeletedFalse(UUID ownerId, String name);

    Page<Folder> findByOwnerIdAndParentFolderIdAndDeletedFalse(UUID ownerId, UUID parentFolderId, Pageable pageable);

    Page<Folder> findByOwnerIdAndParentFolderIdIsNullAndDeletedFalse(UUID ownerId, Pageable pageable);

    boolean existsByOwnerIdAndParentFolderIdAndDeletedFalse(UUID ownerId, UUID parentFolderId);

    @Query("SELECT f FROM Folder f WHERE f.ownerId = :ownerId AND f.deleted = false " +
            "AND f.parentFolderId = :parentId " +
            "AND (LOWER(f.name) LIKE :pattern ESCAPE '!' OR LOWER(f.description) LIKE :pattern ESCAPE '!')")
    Page<Folder> searchInParent(@Param("ownerId") UUID ownerId,
                                @Param("parentId") UUID parentId,
                                @Param("pattern") String pattern,
                                Pageable pageable);

    @Query("SELECT f FROM Folder f WHERE f.ownerId = :ownerId AND f.deleted = false " +
            "AND f.parentFolderId IS NULL " +
            "AND (LOWER(f.name) LIKE :pattern ESCAPE '!' OR LOWER(f.description) LIKE :pattern ESCAPE '!')")
    Page<Folder> searchInRoot(@Param("ownerId") UUID ownerId,
                              @Param("pattern") String pattern,
                              Pageable pageable);

    default Optional<Folder> findSibling(UUID ownerId, String name, UUID parentFolderId) {
        return parentFolderId == null
                ? findFirstByOwnerIdAndNameAndParentFolderIdIsNullAndDeletedFalse(ownerId, name)
                : findFirstByOwnerIdAndNameAndParentFolderIdAndDeletedFalse(ownerId, name, parentFolderId);
    }
}
