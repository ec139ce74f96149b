package com.dayloop.timeline;

import com.dayloop.timeline.config.CategoryProperties;
import com.dayloop.timeline.provider.GeminiDirectProvider;
import com.dayloop.timeline.provider.LlmProvider;
import com.dayloop.timeline.service.CategoryTaxonomy;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class DayloopApplicationTest {

    @Autowired
    private LlmProvider provider;

    @Autowired
    private CategoryTaxonomy categoryTaxonomy;

    @Test
    void testContextWiresDefaultProvider() {
        assertThat(provider).isInstanceOf(GeminiDirectProvider.class);
        assertThat(categoryTaxonomy.categories()).extracting(CategoryProperties.Category::getName)
                .containsExactly("Work", "Personal", "Distraction", "Idle");
        assertThat(categoryTaxonomy.normalize("distraction")).isEqualTo("Distraction");
        assertThat(categoryTaxonomy.normalize("something else")).isEqualTo("Work");
    }
}
