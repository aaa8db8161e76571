package com.minidrive.file;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.cloud.openfeign.EnableFeignClients;

/**
 * File 서비스 - 파일 메타데이터 + 로컬 디스크 저장소.
 *
 * <p>업로드 전 Quota 서비스로 용량을 확인하고, 모든 변경을 Audit 서비스에 기록한다.</p>
 */
@SpringBootApplication(scanBasePackages = {
        "com.minidrive.file",
        "com.minidrive.common.exception",
        "com.minidrive.common.security",
        "com.minidrive.common.web",
        "com.minidrive.common.resilience",
        "com.minidrive.common.client"
})
@EnableFeignClients(basePackages = "com.minidrive.common.client")
@ConfigurationPropertiesScan
public class FileServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FileServiceApplication.class, args);
    }
}
