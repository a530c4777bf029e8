package com.adlanda.channelknowledge.model;

import java.time.LocalDate;
import java.util.Map;

/**
 * A curated knowledge-base document after front matter parsing.
 */
public record KnowledgeDocument(
        String source,
        String text,
        String category,
        LocalDate createdDate,
        LocalDate updatedDate,
        LocalDate expiresDate,
        Map<String, Object> metadata
) {}
