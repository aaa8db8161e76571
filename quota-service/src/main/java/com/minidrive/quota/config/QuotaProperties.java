package com.minidrive.quota.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

/** 신규 사용자 기본 한도 */
@ConfigurationProperties("minidrive.quota")
public record QuotaProperties(@DefaultValue("5GB") DataSize defaultLimit) {
}
