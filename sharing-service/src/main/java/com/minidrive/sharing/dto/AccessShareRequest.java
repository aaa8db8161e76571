package com.minidrive.sharing.dto;

public record AccessShareRequest(String password) {
}
