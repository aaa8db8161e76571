package com.minidrive.sharing.repository;

import com.minidrive.sharing.entity.Share;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ShareRepository extends JpaRepository<Share, UUID> {

    Optional<Share> findByIdAndDeletedFalse(UUID id);

    Optional<Share> findByShareTokenAndActiveTrueAndDeletedFalse(String shareToken);

    List<Share> findByOwnerIdAndDeletedFalseOrderByCreatedAtDesc(UUID ownerId);

    List<Share> findBySharedWithUserIdAndActiveTrueAndDeletedFalseOrderByCreatedAtDesc(UUID sharedWithUserId);

    List<Share> findByResourceIdAndResourceTypeAndOwnerIdAndDeletedFalseOrderByCreatedAtDesc(
            UUID resourceId, String resourceType, UUID ownerId);

    boolean existsByResourceIdAndResourceTypeAndSharedWithUserIdAndActiveTrueAndDeletedFalse(
            UUID resourceId, String resourceType, UUID sharedWithUserId);

    /**
     * 다운로드 횟수 원자적 증가. 한도에 도달했으면 갱신하지 않는다.
     *
     * @return 1 = 증가, 0 = 한도 도달 (동시 요청에 밀린 경우 포함)
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Share s SET s.currentDownloads = s.currentDownloads + 1 " +
            "WHERE s.id = :id AND (s.maxDownloads IS NULL OR s.currentDownloads < s.maxDownloads)")
    int incrementDownloads(@Param("id") UUID id);
}
