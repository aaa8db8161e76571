package com.minidrive.file.validation;

import java.util.Optional;

/**
 * 파일 이름 / 설명 / 검색어 검증.
 * 위반 시 사용자에게 그대로 보여줄 메시지를 반환하고, 통과하면 empty.
 */
public final class FileNameValidator {

    public static final int MAX_FILE_NAME_LENGTH = 255;
    public static final int MAX_DESCRIPTION_LENGTH = 5000;
    public static final int MAX_SEARCH_TERM_LENGTH = 1000;

    private static final String INVALID_CHARS = "/\\:*?\"<>|";

    private FileNameValidator() {
    }

    public static Optional<String> validateFileName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return Optional.of("File name cannot be empty.");
        }
        if (fileName.length() > MAX_FILE_NAME_LENGTH) {
            return Optional.of("File name exceeds maximum length of 255 characters.");
        }
        if (fileName.chars().anyMatch(FileNameValidator::isInvalidChar)) {
            return Optional.of("File name contains invalid characters.");
        }
        if (fileName.contains("..") || fileName.startsWith(".")) {
            return Optional.of("File name cannot contain path traversal patterns.");
        }
        // NUL 은 제어 문자라 위에서 먼저 걸린다
        if (fileName.indexOf('\0') >= 0) {
            return Optional.of("File name contains null bytes.");
        }
        return Optional.empty();
    }

    public static Optional<String> validateDescription(String description) {
        if (description == null || description.isBlank()) {
            return Optional.empty();
        }
        if (description.length() > MAX_DESCRIPTION_LENGTH) {
            return Optional.of("Description exceeds maximum length of 5000 characters.");
        }
        if (description.indexOf('\0') >= 0) {
            return Optional.of("Description contains null bytes.");
        }
        return Optional.empty();
    }

    public static Optional<String> validateSearchTerm(String searchTerm) {
        if (searchTerm == null || searchTerm.isBlank()) {
            return Optional.empty();
        }
        if (searchTerm.length() > MAX_SEARCH_TERM_LENGTH) {
            return Optional.of("Search term exceeds maximum length of 1000 characters.");
        }
        if (searchTerm.indexOf('\0') >= 0) {
            return Optional.of("Search term contains null bytes.");
        }
        return Optional.empty();
    }

    static boolean isInvalidChar(int c) {
        return INVALID_CHARS.indexOf(c) >= 0 || Character.isISOControl(c);
    }
}
