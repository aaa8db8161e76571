package com.minidrive.file.storage;

import com.minidrive.common.exception.BusinessException;
import com.minidrive.common.exception.ErrorCode;
import com.minidrive.file.config.StorageProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 로컬 디스크 저장소 (Local File Storage)
 *
 * <h3>저장 구조</h3>
 * <pre>
 *   {basePath}/2026/10/3f2a...-uuid_report.pdf
 *   DB 에는 "2026/10/3f2a...-uuid_report.pdf" (상대 경로, '/' 구분) 만 저장
 * </pre>
 *
 * <p>모든 경로는 정규화 후 basePath 안에 있는지 확인한다 ("../" 탈출 차단).</p>
 */
@Slf4j
@Component
public class LocalFileStorage {

    private final Path basePath;
    private final long maxFileSizeBytes;
    private final Set<String> allowedExtensions;  // 소문자, '.' 제외

    public LocalFileStorage(StorageProperties properties) {
        this.basePath = Paths.get(properties.basePath()).toAbsolutePath().normalize();
        this.maxFileSizeBytes = properties.maxFileSize().toBytes();
        this.allowedExtensions = properties.allowedExtensions().stream()
                .map(LocalFileStorage::normalizeExtension)
                .filter(ext -> !ext.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        try {
            Files.createDirectories(basePath);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create storage directory " + basePath, e);
        }
    }

    /**
     * @return 저장된 파일의 상대 경로
     */
    public String save(InputStream content, long size, String fileName) {
        if (content == null || size <= 0) {
            throw new BusinessException(ErrorCode.EMPTY_FILE);
        }
        if (fileName == null || fileName.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_FILE_NAME, "File name cannot be null or empty.");
        }
        if (size > maxFileSizeBytes) {
            throw new BusinessException(ErrorCode.FILE_TOO_LARGE, String.format(
                    "File size %d bytes exceeds maximum allowed size %d bytes.", size, maxFileSizeBytes));
        }

        String extension = normalizeExtension(extensionOf(fileName));
        if (!allowedExtensions.isEmpty() && !allowedExtensions.contains(extension)) {
            throw new BusinessException(ErrorCode.EXTENSION_NOT_ALLOWED, String.format(
                    "File extension '.%s' is not allowed. Allowed extensions: %s",
                    extension, String.join(", ", allowedExtensions)));
        }

        ZonedDateTime now = ZonedDateTime.now(ZoneOffset.UTC);
        String directory = String.format("%04d/%02d", now.getYear(), now.getMonthValue());
        String relativePath = directory + "/" + UUID.randomUUID() + "_" + sanitize(fileName);

        Path target = basePath.resolve(relativePath).normalize();
        try {
            Files.createDirectories(target.getParent());
            Files.copy(content, target);
        } catch (IOException e) {
            throw new BusinessException(ErrorCode.STORAGE_FAILURE, "Failed to write file: " + e.getMessage(), e);
        }

        log.debug("Stored file: path={}, size={}", relativePath, size);
        return relativePath;
    }

    public Resource load(String relativePath) {
        Path path = resolve(relativePath);
        if (!Files.isRegularFile(path)) {
            throw new BusinessException(ErrorCode.STORED_FILE_MISSING, "File not found at path: " + relativePath);
        }
        return new FileSystemResource(path);
    }

    /** 없는 파일 삭제는 무시 */
    public void delete(String relativePath) {
        Path path = resolve(relativePath);
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new BusinessException(ErrorCode.STORAGE_FAILURE, e.getMessage(), e);
        }
    }

    public Path resolve(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_STORAGE_PATH, "Path cannot be null or empty.");
        }
        Path full = basePath.resolve(relativePath).normalize();
        if (!full.startsWith(basePath)) {
            log.warn("Storage path escapes base directory: {}", relativePath);
            throw new BusinessException(ErrorCode.INVALID_STORAGE_PATH);
        }
        return full;
    }

    /** 금지 문자를 기준으로 잘라 '_' 로 다시 잇는다 */
    static String sanitize(String fileName) {
        String sanitized = Arrays.stream(fileName.split("[/\\\\:*?\"<>|\\p{Cntrl}]+"))
                .filter(part -> !part.isEmpty())
                .collect(Collectors.joining("_"))
                .trim();
        return sanitized.isEmpty() ? "file" : sanitized;
    }

    private static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 ? fileName.substring(dot + 1) : "";
    }

    private static String normalizeExtension(String extension) {
        String trimmed = extension.trim();
        if (trimmed.startsWith(".")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }
}
