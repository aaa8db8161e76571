package com.minidrive.sharing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;

/**
 * Sharing 서비스 - 파일/폴더 공유 (사용자 지정 공유, 공개 링크).
 *
 * <p>공유 생성 시 File / Folder 서비스에 호출자 토큰으로 리소스를 조회해 소유권을 확인한다.</p>
 */
@SpringBootApplication(scanBasePackages = {
        "com.minidrive.sharing",
        "com.minidrive.common.exception",
        "com.minidrive.common.security",
        "com.minidrive.common.web",
        "com.minidrive.common.resilience",
        "com.minidrive.common.client"
})
@EnableFeignClients(basePackages = {"com.minidrive.common.client", "com.minidrive.sharing.client"})
public class SharingServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SharingServiceApplication.class, args);
    }
}
