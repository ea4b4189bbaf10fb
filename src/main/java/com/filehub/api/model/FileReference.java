package com.filehub.api.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.ForeignKey;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * An additional name for content that is already stored as a {@link StoredFile}.
 * No cascade from the owning file: references are always removed one by one first.
 */
@Entity
@Table(name = "file_references",
        uniqueConstraints = @UniqueConstraint(name = "uk_file_references_name", columnNames = "reference_name"),
        indexes = @Index(name = "idx_file_references_file", columnList = "original_file_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileReference {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "original_file_id", nullable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_file_references_file"))
    private StoredFile originalFile;

    @Column(name = "reference_name", nullable = false)
    private String referenceName;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
