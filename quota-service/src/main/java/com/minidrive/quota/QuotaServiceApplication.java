package com.minidrive.quota;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.cloud.openfeign.EnableFeignClients;

/**
 * Quota 서비스 - 사용자별 저장 용량 카운터.
 *
 * <p>File 서비스가 업로드 전 can-upload 로 확인하고, 저장/영구 삭제 후 increase/decrease 로 갱신한다.</p>
 */
@SpringBootApplication(scanBasePackages = {
        "com.minidrive.quota",
        "com.minidrive.common.exception",
        "com.minidrive.common.security",
        "com.minidrive.common.web",
        "com.minidrive.common.resilience",
        "com.minidrive.common.client"
})
@EnableFeignClients(basePackages = "com.minidrive.common.client")
@ConfigurationPropertiesScan
public class QuotaServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuotaServiceApplication.class, args);
    }
}
