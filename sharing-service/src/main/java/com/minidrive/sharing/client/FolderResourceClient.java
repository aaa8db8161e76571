package com.minidrive.sharing.client;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;

import java.util.UUID;

/** 호출자 토큰으로 폴더를 조회한다. 2xx 면 호출자가 소유자. */
@FeignClient(name = "folder-service", url = "${folder-service.url:http://localhost:8083}")
public interface FolderResourceClient {

    @GetMapping("/api/folders/{id}")
    void getFolder(@PathVariable("id") UUID folderId, @RequestHeader("Authorization") String authorization);
}
