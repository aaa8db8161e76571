package com.minidrive.common.exception;

import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * 전역 예외 처리기 (Global Exception Handler)
 *
 * <p>모든 MiniDrive 서블릿 서비스에서 공유하는 중앙 집중식 예외 처리.
 * RFC 7807 ProblemDetail 형식으로 에러 응답을 통일한다.</p>
 *
 * <h3>처리하는 예외 유형</h3>
 * <ol>
 *   <li><b>BusinessException</b>: 도메인 규칙 위반 (파일 미발견, 쿼터 초과 등)</li>
 *   <li><b>MethodArgumentNotValidException</b>: Bean Validation 실패 → 필드별 에러</li>
 *   <li><b>MaxUploadSizeExceededException</b>: multipart 업로드 한도 초과</li>
 *   <li><b>RequestNotPermitted / BulkheadFullException / CallNotPermittedException / TimeoutException</b>:
 *       Resilience4j 트래픽 제어</li>
 * </ol>
 *
 * <p>응답 예시:</p>
 * <pre>
 *   {
 *     "type": "https://minidrive.dev/errors/file_not_found",
 *     "status": 404,
 *     "detail": "File not found or access denied."
 *   }
 * </pre>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String ERROR_TYPE_BASE = "https://minidrive.dev/errors/";

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ProblemDetail> handleBusinessException(BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode.getStatus().is5xxServerError()) {
            log.error("Business error [{}]: {}", errorCode, e.getMessage(), e);
        } else {
            log.debug("Business error [{}]: {}", errorCode, e.getMessage());
        }
        return problem(errorCode, e.getMessage());
    }

    /** Bean Validation 실패 - 필드별 메시지를 errors 속성으로 함께 반환 */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(MethodArgumentNotValidException e) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            errors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        ResponseEntity<ProblemDetail> response = problem(ErrorCode.INVALID_INPUT, ErrorCode.INVALID_INPUT.getMessage());
        response.getBody().setProperty("errors", errors);
        return response;
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ProblemDetail> handleMaxUploadSize(MaxUploadSizeExceededException e) {
        log.warn("Upload rejected by multipart limit: {}", e.getMessage());
        return problem(ErrorCode.FILE_TOO_LARGE, ErrorCode.FILE_TOO_LARGE.getMessage());
    }

    // Resilience4j Rate Limiter
    @ExceptionHandler(RequestNotPermitted.class)
    public ResponseEntity<ProblemDetail> handleRateLimitExceeded(RequestNotPermitted e) {
        log.warn("Rate limit exceeded: {}", e.getMessage());
        return problem(ErrorCode.RATE_LIMIT_EXCEEDED, ErrorCode.RATE_LIMIT_EXCEEDED.getMessage());
    }

    // Resilience4j Bulkhead
    @ExceptionHandler(BulkheadFullException.class)
    public ResponseEntity<ProblemDetail> handleBulkheadFull(BulkheadFullException e) {
        log.warn("Bulkhead full: {}", e.getMessage());
        return problem(ErrorCode.BULKHEAD_FULL, ErrorCode.BULKHEAD_FULL.getMessage());
    }

    // Resilience4j Circuit Breaker OPEN
    @ExceptionHandler(CallNotPermittedException.class)
    public ResponseEntity<ProblemDetail> handleCircuitBreakerOpen(CallNotPermittedException e) {
        log.warn("Circuit breaker open: {}", e.getMessage());
        return problem(ErrorCode.CIRCUIT_BREAKER_OPEN, ErrorCode.CIRCUIT_BREAKER_OPEN.getMessage());
    }

    @ExceptionHandler(TimeoutException.class)
    public ResponseEntity<ProblemDetail> handleTimeout(TimeoutException e) {
        log.warn("Request timeout: {}", e.getMessage());
        return problem(ErrorCode.REQUEST_TIMEOUT, ErrorCode.REQUEST_TIMEOUT.getMessage());
    }

    private ResponseEntity<ProblemDetail> problem(ErrorCode errorCode, String detail) {
        HttpStatus status = errorCode.getStatus();
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        // type URI: 에러 코드명을 소문자로 변환
        problem.setType(URI.create(ERROR_TYPE_BASE + errorCode.name().toLowerCase()));
        return ResponseEntity.status(status).body(problem);
    }
}
