package com.adlanda.channelknowledge.service;

import com.adlanda.channelknowledge.config.PipelineProperties;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Locale;

/**
 * Index category and expiry rules.
 */
@Component
public class CategoryPolicy {

    private final PipelineProperties properties;

    public CategoryPolicy(PipelineProperties properties) {
        this.properties = properties;
    }

    /**
     * Index category for a channel's style category; unknown values map to the default category.
     */
    public String categoryFor(String styleCategory) {
        if (styleCategory == null || styleCategory.isBlank()) {
            return properties.getDefaultCategory();
        }
        String mapped = properties.getCategoryMapping().get(styleCategory.toLowerCase(Locale.ROOT));
        return mapped != null ? mapped : properties.getDefaultCategory();
    }

    /**
     * Expiry date of content in {@code category} that was created on {@code created}.
     */
    public LocalDate expiresFor(String category, LocalDate created) {
        return created.plusDays(properties.expiryDaysFor(category));
    }
}
