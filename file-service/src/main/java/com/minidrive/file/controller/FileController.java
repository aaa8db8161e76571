package com.minidrive.file.controller;

import com.minidrive.common.dto.ApiResponse;
import com.minidrive.common.dto.PageQuery;
import com.minidrive.common.dto.PagedResult;
import com.minidrive.common.web.auth.LoginUser;
import com.minidrive.common.web.request.ClientInfo;
import com.minidrive.file.dto.FileDownload;
import com.minidrive.file.dto.FileResponse;
import com.minidrive.file.dto.StorageUsageResponse;
import com.minidrive.file.dto.UpdateFileRequest;
import com.minidrive.file.service.FileService;
import io.github.resilience4j.bulkhead.annotation.Bulkhead;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/files")
@RequiredArgsConstructor
public class FileController {

    private final FileService fileService;

    /** 업로드는 디스크 I/O 가 크므로 Bulkhead 로 동시 처리 수 제한 */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    @RateLimiter(name = "fileUpload")
    @Bulkhead(name = "fileUpload")
    public ApiResponse<FileResponse> upload(@LoginUser UUID userId,
                                            @RequestParam("file") MultipartFile file,
                                            @RequestParam(required = false) UUID folderId,
                                            @RequestParam(required = false) String description,
                                            ClientInfo client) {
        return ApiResponse.ok(fileService.upload(userId, file, folderId, description, client));
    }

    @GetMapping("/{id}")
    public ApiResponse<FileResponse> getFile(@LoginUser UUID userId, @PathVariable UUID id) {
        return ApiResponse.ok(fileService.getFile(id, userId));
    }

    @GetMapping("/{id}/download")
    @RateLimiter(name = "fileApi")
    public ResponseEntity<Resource> download(@LoginUser UUID userId, @PathVariable UUID id) {
        FileDownload download = fileService.download(id, userId);
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(download.file().getFileName(), StandardCharsets.UTF_8)
                .build();
        return ResponseEntity.ok()
                .contentType(mediaTypeOf(download.file().getContentType()))
                .contentLength(download.file().getSizeBytes())
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .body(download.content());
    }

    @GetMapping({"", "/list"})
    @RateLimiter(name = "fileApi")
    public ApiResponse<PagedResult<FileResponse>> list(@LoginUser UUID userId,
                                                       @RequestParam(required = false) UUID folderId,
                                                       @RequestParam(required = false) String search,
                                                       @RequestParam(required = false) Integer pageNumber,
                                                       @RequestParam(required = false) Integer pageSize) {
        return ApiResponse.ok(fileService.list(userId, folderId, search, PageQuery.of(pageNumber, pageSize)));
    }

    @PutMapping("/{id}")
    public ApiResponse<FileResponse> update(@LoginUser UUID userId, @PathVariable UUID id,
                                            @RequestBody UpdateFileRequest request) {
        return ApiResponse.ok(fileService.update(id, userId, request));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@LoginUser UUID userId, @PathVariable UUID id, ClientInfo client) {
        fileService.delete(id, userId, client);
    }

    @DeleteMapping("/{id}/permanent")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deletePermanently(@LoginUser UUID userId, @PathVariable UUID id, ClientInfo client) {
        fileService.deletePermanently(id, userId, client);
    }

    @GetMapping("/storage/used")
    public ApiResponse<StorageUsageResponse> storageUsed(@LoginUser UUID userId) {
        return ApiResponse.ok(fileService.storageUsed(userId));
    }

    /** 저장된 Content-Type 이 비었거나 형식이 깨졌으면 octet-stream 으로 내려준다. */
    private static MediaType mediaTypeOf(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
        try {
            return MediaType.parseMediaType(contentType);
        } catch (InvalidMediaTypeException e) {
            log.warn("Invalid stored content type '{}', using octet-stream: {}", contentType, e.getMessage());
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }
}
