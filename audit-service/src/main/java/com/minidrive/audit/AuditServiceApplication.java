package com.minidrive.audit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;

/**
 * Audit 서비스 - 다른 서비스가 보낸 감사 로그 저장 및 조회.
 */
@SpringBootApplication(scanBasePackages = {
        "com.minidrive.audit",
        "com.minidrive.common.exception",
        "com.minidrive.common.security",
        "com.minidrive.common.web",
        "com.minidrive.common.resilience",
        "com.minidrive.common.client"
})
@EnableFeignClients(basePackages = "com.minidrive.common.client")
public class AuditServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuditServiceApplication.class, args);
    }
}
