package com.minidrive.identity.repository;

import com.minidrive.identity.entity.Session;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.UUID;

public interface SessionRepository extends JpaRepository<Session, String> {

    /** 만료 세션 일괄 삭제 (로그인/세션 생성 시 호출) */
    @Modifying
    @Query("DELETE FROM Session s WHERE s.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM Session s WHERE s.userId = :userId")
    int deleteAllByUserId(@Param("userId") UUID userId);
}
