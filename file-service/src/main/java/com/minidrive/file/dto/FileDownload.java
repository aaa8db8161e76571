package com.minidrive.file.dto;

import com.minidrive.file.entity.FileEntry;
import org.springframework.core.io.Resource;

public record FileDownload(FileEntry file, Resource content) {
}
