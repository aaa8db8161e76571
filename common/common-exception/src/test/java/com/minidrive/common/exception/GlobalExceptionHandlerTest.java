package com.minidrive.common.exception;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("BusinessException - ErrorCode 의 상태 코드와 커스텀 메시지로 ProblemDetail 생성")
    void handleBusinessException_UsesErrorCodeStatus() {
        // When
        ResponseEntity<ProblemDetail> response = handler.handleBusinessException(
                new BusinessException(ErrorCode.QUOTA_EXCEEDED, "Storage quota exceeded. Used: 1 bytes"));

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.PAYLOAD_TOO_LARGE);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().getDetail()).isEqualTo("Storage quota exceeded. Used: 1 bytes");
        assertThat(response.getBody().getType().toString())
                .isEqualTo("https://minidrive.dev/errors/quota_exceeded");
    }

    @Test
    @DisplayName("BusinessException - 메시지 미지정 시 ErrorCode 기본 메시지 사용")
    void handleBusinessException_DefaultMessage() {
        ResponseEntity<ProblemDetail> response = handler.handleBusinessException(
                new BusinessException(ErrorCode.FILE_NOT_FOUND));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().getDetail()).isEqualTo("File not found or access denied.");
    }

    @Test
    @DisplayName("Rate Limiter 초과 시 429 반환")
    void handleRateLimitExceeded_Returns429() {
        RequestNotPermitted exception = RequestNotPermitted.createRequestNotPermitted(
                RateLimiter.ofDefaults("fileApi"));

        ResponseEntity<ProblemDetail> response = handler.handleRateLimitExceeded(exception);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(response.getBody().getType().toString()).endsWith("/rate_limit_exceeded");
    }
}
