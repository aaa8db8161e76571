package com.minidrive.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 공통 API 응답 래퍼 (Common API Response Wrapper)
 *
 * <p>모든 MiniDrive 서비스가 동일한 성공 응답 형식을 사용하도록 강제하는 공통 DTO.
 * 실패 응답은 GlobalExceptionHandler가 RFC 7807 ProblemDetail로 내려주므로
 * 이 래퍼는 주로 성공 응답에 쓰인다.</p>
 *
 * <h3>사용 예시</h3>
 * <pre>
 *   // 성공: {"success": true, "data": {...}}
 *   return ApiResponse.ok(fileResponse);
 *
 *   // 실패: {"success": false, "message": "Quota not found."}
 *   return ApiResponse.error("Quota not found.");
 * </pre>
 *
 * @param <T> 응답 데이터의 타입
 */
@JsonInclude(JsonInclude.Include.NON_NULL) // null 필드는 JSON에서 제외
public record ApiResponse<T>(
        boolean success, // 요청 성공 여부
        T data,          // 성공 시 응답 데이터
        String message   // 실패 시 에러 메시지
) {
    /** 성공 응답 팩토리 메서드 */
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    /** 실패 응답 팩토리 메서드 */
    public static <T> ApiResponse<T> error(String message) {
        return new ApiResponse<>(false, null, message);
    }
}
