package com.minidrive.file.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;
import java.util.UUID;

/**
 * 파일 메타데이터.
 * 실제 바이트는 {@code storagePath} (저장소 루트 기준 상대 경로) 에 있다.
 * 삭제는 soft delete 가 기본이며, 영구 삭제 시에만 행과 파일이 함께 사라진다.
 */
@Entity
@Table(name = "file_entries", indexes = {
        @Index(name = "idx_file_owner_folder", columnList = "ownerId, folderId, deleted")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class FileEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Version
    private Long version;

    @Column(nullable = false)
    private String fileName;

    @Column(nullable = false)
    private String contentType;

    @Column(nullable = false)
    private long sizeBytes;

    @Column(nullable = false, length = 512)
    private String storagePath;

    @Column(nullable = false)
    private UUID ownerId;

    private UUID folderId;  // null = 루트

    @Column(nullable = false, length = 64)
    private String extension;

    @Column(length = 5000)
    private String description;

    @Column(nullable = false)
    private boolean deleted;

    private Instant deletedAt;

    @CreatedDate
    @Column(updatable = false)
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    @Builder
    public FileEntry(String fileName, String contentType, long sizeBytes, String storagePath,
                     UUID ownerId, UUID folderId, String description) {
        this.fileName = fileName;
        this.contentType = contentType;
        this.sizeBytes = sizeBytes;
        this.storagePath = storagePath;
        this.ownerId = ownerId;
        this.folderId = folderId;
        this.description = description;
        this.extension = extensionOf(fileName);
        this.deleted = false;
    }

    public void rename(String fileName) {
        this.fileName = fileName;
        this.extension = extensionOf(fileName);
    }

    public void changeDescription(String description) {
        this.description = description;
    }

    public void moveTo(UUID folderId) {
        this.folderId = folderId;
    }

    public void markDeleted(Instant at) {
        this.deleted = true;
        this.deletedAt = at;
    }

    /** "report.final.pdf" → ".pdf", 확장자가 없으면 빈 문자열 */
    static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 && dot < fileName.length() - 1 ? fileName.substring(dot) : "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileEntry other)) return false;
        return id != null && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
