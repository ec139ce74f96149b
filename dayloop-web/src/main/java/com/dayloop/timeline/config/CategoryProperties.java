package com.dayloop.timeline.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * User-defined activity taxonomy handed to card synthesis.
 */
@Data
@ConfigurationProperties(prefix = "dayloop")
public class CategoryProperties {

    private List<Category> categories = new ArrayList<>(List.of(
            new Category("work", "Work", "Focused work: coding, writing, meetings, research", false, false),
            new Category("personal", "Personal", "Personal errands, chores, planning, messages", false, false),
            new Category("distraction", "Distraction", "Entertainment, social media, aimless browsing", false, false),
            new Category("idle", "Idle", "No meaningful activity on screen", true, true)
    ));

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Category {
        private String id;
        private String name;
        private String description;
        private boolean system;
        private boolean idle;
    }
}
