package com.adlanda.channelknowledge.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A bounded piece of source text ready for embedding.
 *
 * The content already carries the section title prefix when the chunk came from a
 * titled section.
 */
public record Chunk(
        int index,
        String sourceId,
        String sectionTitle,
        String content,
        String category,
        LocalDate createdDate,
        LocalDate updatedDate,
        LocalDate expiresDate,
        String contentHash
) {

    public Chunk {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(createdDate, "createdDate");
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Chunk content must not be blank");
        }
        if (updatedDate == null) {
            updatedDate = createdDate;
        }
        if (expiresDate != null && expiresDate.isBefore(createdDate)) {
            throw new IllegalArgumentException(
                    "expiresDate " + expiresDate + " is before createdDate " + createdDate + " for " + sourceId);
        }
    }

    public boolean isExpired(LocalDate today) {
        return expiresDate != null && expiresDate.isBefore(today);
    }

    public Chunk withUpdatedDate(LocalDate date) {
        return new Chunk(index, sourceId, sectionTitle, content, category, createdDate, date, expiresDate, contentHash);
    }
}
