package com.filehub.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * One unique content blob. Exactly one row exists per content digest.
 * <p>
 * Content fields are fixed at construction. {@code referenceCount} and {@code storageSaved}
 * are only ever written together, through
 * {@link com.filehub.api.repository.FileRepository#applyReferenceDelta}.
 */
@Entity
@Table(name = "files",
        uniqueConstraints = @UniqueConstraint(name = "uk_files_content_hash", columnNames = "content_hash"),
        indexes = {
                @Index(name = "idx_files_name_type", columnList = "original_filename, file_type"),
                @Index(name = "idx_files_size_uploaded", columnList = "size_bytes, uploaded_at"),
                @Index(name = "idx_files_uploaded", columnList = "uploaded_at")
        })
@Data
@NoArgsConstructor // Required by JPA
public class StoredFile {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "original_filename", nullable = false)
    private String originalFilename;

    @Column(name = "file_type", nullable = false, length = 100)
    private String fileType;

    @Setter(AccessLevel.NONE)
    @Column(name = "size_bytes", nullable = false)
    private long size;

    @Setter(AccessLevel.NONE)
    @Column(name = "uploaded_at", nullable = false, updatable = false)
    private LocalDateTime uploadedAt;

    // NULL only for legacy rows awaiting backfill
    @Setter(AccessLevel.NONE)
    @Column(name = "content_hash", length = 64)
    private String contentHash;

    // Blob store key, never exposed
    @Setter(AccessLevel.NONE)
    @JsonIgnore
    @Column(name = "storage_key", nullable = false, updatable = false)
    private String storageKey;

    @Setter(AccessLevel.NONE)
    @Column(name = "reference_count", nullable = false)
    private int referenceCount = 1;

    @Setter(AccessLevel.NONE)
    @Column(name = "storage_saved", nullable = false)
    private long storageSaved = 0;

    @Builder
    private StoredFile(String originalFilename, String fileType, long size,
                       LocalDateTime uploadedAt, String contentHash, String storageKey) {
        this.originalFilename = originalFilename;
        this.fileType = fileType;
        this.size = size;
        this.uploadedAt = uploadedAt;
        this.contentHash = contentHash;
        this.storageKey = storageKey;
        this.referenceCount = 1;
        this.storageSaved = 0;
    }

    @JsonProperty("storageSavedFormatted")
    public String getStorageSavedFormatted() {
        return ByteSizes.format(storageSaved);
    }
}
