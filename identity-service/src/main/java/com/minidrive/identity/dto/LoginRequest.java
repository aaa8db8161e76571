package com.minidrive.identity.dto;

public record LoginRequest(String email, String password) {
}
