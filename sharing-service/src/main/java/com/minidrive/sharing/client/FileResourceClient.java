package com.minidrive.sharing.client;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;

import java.util.UUID;

/** 호출자 토큰으로 파일을 조회한다. 2xx 면 호출자가 소유자. */
@FeignClient(name = "file-service", url = "${file-service.url:http://localhost:8082}")
public interface FileResourceClient {

    @GetMapping("/api/files/{id}")
    void getFile(@PathVariable("id") UUID fileId, @RequestHeader("Authorization") String authorization);
}
