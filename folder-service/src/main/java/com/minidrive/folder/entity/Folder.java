package com.minidrive.folder.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;
import java.util.UUID;

/**
 * 폴더. parentFolderId 가 null 이면 루트에 위치한다.
 */
@Entity
@Table(name = "folders", indexes = {
        @Index(name = "idx_folder_owner_parent", columnList = "ownerId, parentFolderId, deleted")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Folder {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Version
    private Long version;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private UUID ownerId;

    private UUID parentFolderId;

    @Column(length = 1000)
    private String description;

    @Column(length = 32)
    private String color;

    @Column(nullable = false)
    private boolean deleted;

    private Instant deletedAt;

    @CreatedDate
    @Column(updatable = false)
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    @Builder
    public Folder(String name, UUID ownerId, UUID parentFolderId, String description, String color) {
        this.name = name;
        this.ownerId = ownerId;
        this.parentFolderId = parentFolderId;
        this.description = description;
        this.color = color;
        this.deleted = false;
    }

    public void rename(String name) {
        this.name = name;
    }

    public void changeDescription(String description) {
        this.description = description;
    }

    public void changeColor(String color) {
        this.color = color;
    }

    public void moveTo(UUID parentFolderId) {
        this.parentFolderId = parentFolderId;
    }

    public void markDeleted(Instant at) {
        this.deleted = true;
        this.deletedAt = at;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Folder other)) return false;
        return id != null && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
