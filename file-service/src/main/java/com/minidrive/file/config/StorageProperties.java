package com.minidrive.file.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

import java.util.Set;

/**
 * 로컬 저장소 설정 (minidrive.storage.*)
 *
 * @param basePath          파일이 저장되는 루트 디렉터리
 * @param maxFileSize       파일 하나의 최대 크기
 * @param allowedExtensions 허용 확장자 (대소문자 무시, 비어 있으면 모두 허용)
 */
@ConfigurationProperties(prefix = "minidrive.storage")
public record StorageProperties(
        @DefaultValue("./storage") String basePath,
        @DefaultValue("100MB") DataSize maxFileSize,
        @DefaultValue Set<String> allowedExtensions
) {
}
