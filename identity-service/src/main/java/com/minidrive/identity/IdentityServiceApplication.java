package com.minidrive.identity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Identity 서비스 - 회원가입, 로그인, 세션, JWT 발급.
 *
 * <p>다른 서비스는 GET /api/auth/me 로 세션이 아직 살아있는지 확인한다.</p>
 */
@SpringBootApplication(scanBasePackages = {
        "com.minidrive.identity",
        "com.minidrive.common.exception",
        "com.minidrive.common.security",
        "com.minidrive.common.web",
        "com.minidrive.common.resilience"
})
public class IdentityServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(IdentityServiceApplication.class, args);
    }
}
