package com.minidrive.quota.repository;

import com.minidrive.quota.entity.UserQuota;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface QuotaRepository extends JpaRepository<UserQuota, UUID> {

    Optional<UserQuota> findByUserId(UUID userId);

    /** @return 갱신된 행 수 (0 = 쿼터 없음) */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE UserQuota q SET q.usedBytes = q.usedBytes + :bytes, q.updatedAt = :now WHERE q.userId = :userId")
    int increaseUsed(@Param("userId") UUID userId, @Param("bytes") long bytes, @Param("now") Instant now);

    /** 0 미만으로 내려가지 않는다 */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE UserQuota q SET q.usedBytes = " +
            "CASE WHEN q.usedBytes - :bytes < 0 THEN 0 ELSE q.usedBytes - :bytes END, " +
            "q.updatedAt = :now WHERE q.userId = :userId")
    int decreaseUsed(@Param("userId") UUID userId, @Param("bytes") long bytes, @Param("now") Instant now);
}
