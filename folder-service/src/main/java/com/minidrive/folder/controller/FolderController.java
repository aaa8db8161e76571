package com.minidrive.folder.controller;

import com.minidrive.common.dto.ApiResponse;
import com.minidrive.common.dto.PageQuery;
import com.minidrive.common.dto.PagedResult;
import com.minidrive.common.web.auth.LoginUser;
import com.minidrive.folder.dto.CreateFolderRequest;
import com.minidrive.folder.dto.FolderResponse;
import com.minidrive.folder.dto.UpdateFolderRequest;
import com.minidrive.folder.service.FolderService;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/folders")
@RequiredArgsConstructor
public class FolderController {

    private final FolderService folderService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<FolderResponse> create(@LoginUser UUID userId, @RequestBody CreateFolderRequest request) {
        return ApiResponse.ok(folderService.create(userId, request));
    }

    @GetMapping("/{id}")
    public ApiResponse<FolderResponse> getFolder(@LoginUser UUID userId, @PathVariable UUID id) {
        return ApiResponse.ok(folderService.getFolder(id, userId));
    }

    @GetMapping
    @RateLimiter(name = "folderApi")
    public ApiResponse<PagedResult<FolderResponse>> list(@LoginUser UUID userId,
                                                         @RequestParam(required = false) UUID parentFolderId,
                                                         @RequestParam(required = false) String search,
                                                         @RequestParam(required = false) Integer pageNumber,
                                                         @RequestParam(required = false) Integer pageSize) {
        return ApiResponse.ok(folderService.list(userId, parentFolderId, search, PageQuery.of(pageNumber, pageSize)));
    }

    @GetMapping("/{id}/path")
    public ApiResponse<List<FolderResponse>> path(@LoginUser UUID userId, @PathVariable UUID id) {
        return ApiResponse.ok(folderService.path(id, userId));
    }

    @PutMapping("/{id}")
    public ApiResponse<FolderResponse> update(@LoginUser UUID userId, @PathVariable UUID id,
                                              @RequestBody UpdateFolderRequest request) {
        return ApiResponse.ok(folderService.update(id, userId, request));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@LoginUser UUID userId, @PathVariable UUID id) {
        folderService.delete(id, userId);
    }
}
