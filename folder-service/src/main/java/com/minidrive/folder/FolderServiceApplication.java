package com.minidrive.folder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;

/**
 * Folder 서비스 - 사용자별 폴더 트리.
 */
@SpringBootApplication(scanBasePackages = {
        "com.minidrive.folder",
        "com.minidrive.common.exception",
        "com.minidrive.common.security",
        "com.minidrive.common.web",
        "com.minidrive.common.resilience",
        "com.minidrive.common.client"
})
@EnableFeignClients(basePackages = "com.minidrive.common.client")
public class FolderServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FolderServiceApplication.class, args);
    }
}
