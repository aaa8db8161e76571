package com.minidrive.quota.dto;

/** 실제 파일 합계로 사용량을 재설정할 때 사용 */
public record SyncRequest(long usedBytes) {
}
