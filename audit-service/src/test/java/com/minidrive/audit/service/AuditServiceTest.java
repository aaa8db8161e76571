package com.minidrive.audit.service;

import com.minidrive.audit.dto.AuditLogResponse;
import com.minidrive.audit.dto.LogAuditRequest;
import com.minidrive.audit.entity.AuditLog;
import com.minidrive.audit.repository.AuditLogRepository;
import com.minidrive.common.exception.BusinessException;
import com.minidrive.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class AuditServiceTest {

    @Mock
    private AuditLogRepository auditLogRepository;

    @InjectMocks
    private AuditService auditService;

    private final UUID userId = UUID.randomUUID();

    private LogAuditRequest request(String action, String entityType, String entityId, Boolean success) {
        return new LogAuditRequest(userId, action, entityType, entityId, success,
                "File: a.txt", null, "10.0.0.1", "JUnit");
    }

    @Test
    @DisplayName("기록 - 요청 값 그대로 저장, success 누락 시 true")
    void log_Saves() {
        // Given
        given(auditLogRepository.save(any(AuditLog.class))).willAnswer(invocation -> invocation.getArgument(0));

        // When
        auditService.log(request("FileUpload", "File", "abc", null));

        // Then
        ArgumentCaptor<AuditLog> captor = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(captor.capture());
        AuditLog saved = captor.getValue();
        assertThat(saved.getUserId()).isEqualTo(userId);
        assertThat(saved.getAction()).isEqualTo("FileUpload");
        assertThat(saved.isSuccess()).isTrue();
        assertThat(saved.getIpAddress()).isEqualTo("10.0.0.1");
    }

    @Test
    @DisplayName("기록 - 컬럼 길이를 넘는 자유 텍스트는 잘라서 저장")
    void log_TruncatesOversizedText() {
        // Given
        given(auditLogRepository.save(any(AuditLog.class))).willAnswer(invocation -> invocation.getArgument(0));
        LogAuditRequest oversized = new LogAuditRequest(userId, "FileUpload", "File", "abc", false,
                "d".repeat(5000), "e".repeat(3000), "1".repeat(100), "u".repeat(1000));

        // When
        auditService.log(oversized);

        // Then
        ArgumentCaptor<AuditLog> captor = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(captor.capture());
        AuditLog saved = captor.getValue();
        assertThat(saved.getDetails()).hasSize(AuditLog.MAX_TEXT_LENGTH);
        assertThat(saved.getErrorMessage()).hasSize(AuditLog.MAX_TEXT_LENGTH);
        assertThat(saved.getIpAddress()).hasSize(64);
        assertThat(saved.getUserAgent()).hasSize(512);
    }

    @Test
    @DisplayName("기록 - 필수 필드가 비어 있으면 필드명을 담은 400")
    void log_RequiredFields() {
        assertThatThrownBy(() -> auditService.log(request(" ", "File", "abc", true)))
                .isInstanceOf(BusinessException.class)
                .hasMessage("Action cannot be null or empty.");
        assertThatThrownBy(() -> auditService.log(request("FileUpload", null, "abc", true)))
                .hasMessage("EntityType cannot be null or empty.");
        assertThatThrownBy(() -> auditService.log(request("FileUpload", "File", "", false)))
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_AUDIT_ENTRY);
        verifyNoInteractions(auditLogRepository);
    }

    @ParameterizedTest
    @CsvSource(value = {"null,100", "0,100", "-3,100", "20,20", "5000,1000"}, nullValues = "null")
    @DisplayName("limit 보정 - 기본 100, 최대 1000")
    void effectiveLimit(Integer limit, int expected) {
        assertThat(AuditService.effectiveLimit(limit)).isEqualTo(expected);
    }

    @Test
    @DisplayName("사용자 조회 - 최신순, limit 을 페이지 크기로 사용")
    @SuppressWarnings("unchecked")
    void userLogs_NewestFirstWithLimit() {
        // Given
        AuditLog log = AuditLog.builder().userId(userId).action("FileDelete").entityType("File")
                .entityId("abc").success(true).build();
        given(auditLogRepository.findAll(any(Specification.class), any(Pageable.class)))
                .willReturn(new PageImpl<>(List.of(log)));

        // When
        List<AuditLogResponse> logs = auditService.userLogs(userId, 5, Instant.EPOCH, null);

        // Then
        assertThat(logs).extracting(AuditLogResponse::action).containsExactly("FileDelete");
        ArgumentCaptor<Pageable> captor = ArgumentCaptor.forClass(Pageable.class);
        verify(auditLogRepository).findAll(any(Specification.class), captor.capture());
        assertThat(captor.getValue().getPageSize()).isEqualTo(5);
        assertThat(captor.getValue().getSort().getOrderFor("createdAt").getDirection())
                .isEqualTo(Sort.Direction.DESC);
    }
}
