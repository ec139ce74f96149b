package com.dayloop.timeline.service;

import com.dayloop.timeline.config.CategoryProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class CategoryTaxonomy {

    private final CategoryProperties properties;

    public List<CategoryProperties.Category> categories() {
        return properties.getCategories();
    }

    /**
     * Maps a model's category onto a configured name (by name or id, ignoring case).
     * Unknown values fall back to the first non-system category.
     */
    public String normalize(String raw) {
        List<CategoryProperties.Category> categories = categories();
        if (categories.isEmpty()) {
            return raw;
        }
        if (raw != null) {
            String value = raw.trim();
            for (CategoryProperties.Category c : categories) {
                if (value.equalsIgnoreCase(c.getName()) || value.equalsIgnoreCase(c.getId())) {
                    return c.getName();
                }
            }
        }
        return categories.stream()
                .filter(c -> !c.isSystem())
                .findFirst()
                .orElse(categories.get(0))
                .getName();
    }
}
