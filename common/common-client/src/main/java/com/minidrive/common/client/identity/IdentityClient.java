package com.minidrive.common.client.identity;

import com.minidrive.common.dto.ApiResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;

import java.util.UUID;

/**
 * Identity 서비스 Feign 클라이언트
 *
 * <p>호출자의 토큰을 그대로 전달해 서버 측 세션이 아직 유효한지 확인한다.
 * 로그아웃된 세션이면 401 이 돌아온다.</p>
 */
@FeignClient(name = "identity-service", url = "${identity-service.url:http://localhost:8081}")
public interface IdentityClient {

    @GetMapping("/api/auth/me")
    ApiResponse<CurrentUser> me(@RequestHeader("Authorization") String authorization);

    record CurrentUser(UUID id, String email, String displayName, boolean active) {}
}
