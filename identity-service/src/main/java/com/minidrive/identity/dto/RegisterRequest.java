package com.minidrive.identity.dto;

public record RegisterRequest(String email, String password, String displayName) {
}
