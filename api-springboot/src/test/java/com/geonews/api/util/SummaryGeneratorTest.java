package com.geonews.api.util;

import com.geonews.api.TestArticles;
import com.geonews.api.model.Article;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SummaryGeneratorTest {

    private final SummaryGenerator generator = new SummaryGenerator();

    @Test
    void summarize_keepsLongSentences() {
        String summary = generator.summarize("Metro line three opens to commuters",
                "The corridor links Colaba and SEEPZ. Short one. Ridership is expected to be heavy this week.");

        assertThat(summary).isEqualTo("Metro line three opens to commuters. The corridor links Colaba and SEEPZ.");
    }

    @Test
    void summarize_truncatesDescriptionWhenNoSentenceQualifies() {
        String description = "ab.".repeat(84).substring(0, 250);

        String summary = generator.summarize("Short", description);

        assertThat(summary).endsWith("...").hasSize(203);
    }

    @Test
    void summarize_fallsBackToTitle() {
        assertThat(generator.summarize("Brief", null)).isEqualTo("Brief");
    }

    @Test
    void ensureSummary_keepsExistingSummary() {
        Article article = TestArticles.article("a", 0.5);
        article.setSummary("Already summarised");

        generator.ensureSummary(article);

        assertThat(article.getSummary()).isEqualTo("Already summarised");
    }

    @Test
    void ensureSummary_fillsMissingSummary() {
        Article article = TestArticles.article("a", 0.5);

        generator.ensureSummary(article);

        assertThat(article.getSummary()).isEqualTo("Description of a");
    }
}
