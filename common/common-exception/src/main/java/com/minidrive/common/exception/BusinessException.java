package com.minidrive.common.exception;

import lombok.Getter;

/**
 * 비즈니스 예외 (Business Exception)
 *
 * <p>도메인 규칙 위반 시 발생하는 unchecked 예외.
 * ErrorCode enum 과 결합하여 HTTP 상태 코드와 에러 메시지를 함께 전달한다.</p>
 *
 * <h3>사용 예시</h3>
 * <pre>
 *   throw new BusinessException(ErrorCode.FILE_NOT_FOUND);
 *
 *   // 상세 메시지가 필요한 경우
 *   throw new BusinessException(ErrorCode.QUOTA_EXCEEDED,
 *           "Storage quota exceeded. Used: 10 bytes, Limit: 10 bytes, Available: 0 bytes");
 * </pre>
 */
@Getter
public class BusinessException extends RuntimeException {

    /** 에러 코드 (HTTP 상태 코드 + 기본 메시지) */
    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
