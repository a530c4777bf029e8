package com.adlanda.channelknowledge.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * JPA entity tracking curated knowledge-base documents.
 *
 * Used for incremental loading: a document whose content hash is unchanged is not
 * re-chunked or re-embedded.
 */
@Entity
@Table(name = "ingested_sources")
public class IngestedSource {

    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "source_path", unique = true, nullable = false, length = 500)
    private String sourcePath;

    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @Column(name = "file_size")
    private Long fileSize;

    @Column(name = "entry_count")
    private Integer entryCount;

    @Column(name = "category", length = 100)
    private String category;

    @Column(name = "expires_date")
    private LocalDate expiresDate;

    @Column(name = "ingested_at")
    private LocalDateTime ingestedAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    // Default constructor for JPA
    public IngestedSource() {
        this.id = UUID.randomUUID();
        this.ingestedAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    public IngestedSource(String sourcePath, String contentHash, Long fileSize, Integer entryCount,
                          String category, LocalDate expiresDate) {
        this();
        this.sourcePath = sourcePath;
        this.contentHash = contentHash;
        this.fileSize = fileSize;
        this.entryCount = entryCount;
        this.category = category;
        this.expiresDate = expiresDate;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    public UUID getId() {
        return id;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public String getContentHash() {
        return contentHash;
    }

    public Long getFileSize() {
        return fileSize;
    }

    public Integer getEntryCount() {
        return entryCount;
    }

    public String getCategory() {
        return category;
    }

    public LocalDate getExpiresDate() {
        return expiresDate;
    }

    public LocalDateTime getIngestedAt() {
        return ingestedAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "IngestedSource{" +
                "sourcePath='" + sourcePath + '\'' +
                ", contentHash='" + contentHash + '\'' +
                ", entryCount=" + entryCount +
                ", category='" + category + '\'' +
                '}';
    }
}
