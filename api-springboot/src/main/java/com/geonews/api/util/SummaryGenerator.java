package com.geonews.api.util;

import com.geonews.api.model.Article;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Extractive summary built from an article's title and description.
 */
@Component
public class SummaryGenerator {

    private static final int MAX_SENTENCES = 3;
    private static final int MIN_SENTENCE_LENGTH = 20;
    private static final int MAX_DESCRIPTION_LENGTH = 200;

    public String summarize(Article article) {
        return summarize(article.getTitle(), article.getDescription());
    }

    /**
     * Fills in the article's summary the first time it is served. Concurrent callers
     * write the same value.
     */
    public Article ensureSummary(Article article) {
        if (article.getSummary() == null || article.getSummary().isBlank()) {
            article.setSummary(summarize(article));
        }
        return article;
    }

    /**
     * Up to three sentences longer than 20 characters from "title. description";
     * otherwise the description cut at 200 characters; otherwise the title.
     */
    public String summarize(String title, String description) {
        String safeTitle = title == null ? "" : title.trim();
        String safeDescription = description == null ? "" : description.trim();

        String[] sentences = (safeTitle + ". " + safeDescription).split("\\.");
        List<String> keySentences = new ArrayList<>();
        for (int i = 0; i < Math.min(MAX_SENTENCES, sentences.length); i++) {
            String sentence = sentences[i].trim();
            if (sentence.length() > MIN_SENTENCE_LENGTH) {
                keySentences.add(sentence);
            }
        }

        if (!keySentences.isEmpty()) {
            return String.join(". ", keySentences) + ".";
        }
        if (!safeDescription.isEmpty()) {
            return safeDescription.length() > MAX_DESCRIPTION_LENGTH
                    ? safeDescription.substring(0, MAX_DESCRIPTION_LENGTH) + "..."
                    : safeDescription;
        }
        return safeTitle;
    }
}
