package com.minidrive.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 에러 코드 열거형 (Error Code Enum)
 *
 * <p>모든 MiniDrive 서비스가 공유하는 에러 코드 정의.
 * 각 에러 코드는 HTTP 상태 코드와 기본 에러 메시지를 포함한다.
 * 메시지는 클라이언트에 그대로 노출되므로 내부 정보를 담지 않는다.</p>
 *
 * <h3>에러 코드 분류</h3>
 * <ul>
 *   <li><b>Common</b>: 입력값 오류, 인증 실패, 서비스 불가</li>
 *   <li><b>Resilience4j</b>: 트래픽 제어 관련 에러</li>
 *   <li><b>도메인별</b>: Identity, File, Storage, Folder, Quota, Audit, Sharing</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ── Common ──
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid input value"),
    ENTITY_NOT_FOUND(HttpStatus.NOT_FOUND, "Entity not found"),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "Invalid or missing authorization token."),
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable"),

    // ── Resilience4j 트래픽 제어 ──
    RATE_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "Rate limit exceeded. Please try again later"),
    BULKHEAD_FULL(HttpStatus.SERVICE_UNAVAILABLE, "Too many concurrent requests. Please try again later"),
    CIRCUIT_BREAKER_OPEN(HttpStatus.SERVICE_UNAVAILABLE, "Service circuit breaker is open"),
    REQUEST_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "Request timed out"),

    // ── Identity ──
    CREDENTIALS_REQUIRED(HttpStatus.BAD_REQUEST, "Email and password are required."),
    EMAIL_ALREADY_REGISTERED(HttpStatus.CONFLICT, "Email is already registered."),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid credentials."),
    MISSING_AUTHORIZATION(HttpStatus.UNAUTHORIZED, "Missing or invalid Authorization header."),
    SESSION_NOT_FOUND(HttpStatus.NOT_FOUND, "Session not found or already expired."),
    SESSION_INVALID(HttpStatus.UNAUTHORIZED, "Session expired or invalid."),

    // ── File ──
    FILE_NOT_FOUND(HttpStatus.NOT_FOUND, "File not found or access denied."),
    EMPTY_FILE(HttpStatus.BAD_REQUEST, "File stream cannot be null or empty."),
    INVALID_FILE_NAME(HttpStatus.BAD_REQUEST, "File name is invalid."),
    INVALID_DESCRIPTION(HttpStatus.BAD_REQUEST, "Description is invalid."),
    INVALID_SEARCH_TERM(HttpStatus.BAD_REQUEST, "Search term is invalid."),
    QUOTA_EXCEEDED(HttpStatus.PAYLOAD_TOO_LARGE, "Storage quota exceeded."),
    UPLOAD_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to upload file."),

    // ── Storage (로컬 디스크) ──
    FILE_TOO_LARGE(HttpStatus.PAYLOAD_TOO_LARGE, "File exceeds maximum allowed size."),
    EXTENSION_NOT_ALLOWED(HttpStatus.BAD_REQUEST, "File extension is not allowed."),
    INVALID_STORAGE_PATH(HttpStatus.BAD_REQUEST, "Access to the specified path is not allowed."),
    STORED_FILE_MISSING(HttpStatus.NOT_FOUND, "Stored file content not found."),
    STORAGE_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "Storage operation failed."),

    // ── Folder ──
    FOLDER_NAME_REQUIRED(HttpStatus.BAD_REQUEST, "Folder name cannot be null or empty."),
    FOLDER_NOT_FOUND(HttpStatus.NOT_FOUND, "Folder not found or access denied."),
    PARENT_FOLDER_NOT_FOUND(HttpStatus.NOT_FOUND, "Parent folder not found or access denied."),
    DUPLICATE_FOLDER_NAME(HttpStatus.CONFLICT, "A folder with this name already exists in the specified location."),
    FOLDER_MOVE_INTO_SELF(HttpStatus.BAD_REQUEST, "Cannot move folder into itself."),
    FOLDER_MOVE_INTO_DESCENDANT(HttpStatus.BAD_REQUEST, "Cannot move folder into its own descendant."),
    FOLDER_NOT_EMPTY(HttpStatus.CONFLICT,
            "Cannot delete folder that contains subfolders. Please delete or move subfolders first."),

    // ── Quota ──
    QUOTA_NOT_FOUND(HttpStatus.NOT_FOUND, "Quota not found."),
    NEGATIVE_BYTES(HttpStatus.BAD_REQUEST, "Bytes cannot be negative."),

    // ── Audit ──
    INVALID_AUDIT_ENTRY(HttpStatus.BAD_REQUEST, "Audit entry is invalid."),

    // ── Sharing ──
    SHARE_NOT_FOUND(HttpStatus.NOT_FOUND, "Share not found."),
    PUBLIC_SHARE_NOT_FOUND(HttpStatus.NOT_FOUND, "Share not found or has expired."),
    SHARE_ACCESS_DENIED(HttpStatus.FORBIDDEN, "You don't have permission to access this share."),
    SHARE_EXPIRED(HttpStatus.GONE, "Share has expired."),
    SHARE_DOWNLOAD_LIMIT_REACHED(HttpStatus.GONE, "Download limit reached for this share."),
    DUPLICATE_SHARE(HttpStatus.CONFLICT, "This resource is already shared with this user."),
    INVALID_SHARE_PASSWORD(HttpStatus.UNAUTHORIZED, "Invalid password."),
    INVALID_SHARE_REQUEST(HttpStatus.BAD_REQUEST, "Share request is invalid."),
    RESOURCE_NOT_FOUND(HttpStatus.NOT_FOUND, "Resource not found or access denied.");

    private final HttpStatus status;   // HTTP 응답 상태 코드
    private final String message;      // 기본 에러 메시지
}
