package com.geonews.indexer.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Article as it arrives from the seed file or the news-articles topic
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NewsRecord {

    private String id;
    private String title;
    private String description;
    private String url;

    @JsonProperty("publication_date")
    private String publicationDate;

    @JsonProperty("source_name")
    private String sourceName;

    private List<String> category;

    @JsonProperty("relevance_score")
    private Double relevanceScore;

    private Double latitude;
    private Double longitude;

    @JsonProperty("llm_summary")
    private String llmSummary;

    public boolean isIndexable() {
        return id != null && !id.isBlank() && title != null && !title.isBlank();
    }

    /**
     * Document shape the API queries: lowercase categories, a geo_point when both coordinates
     * are present, a missing relevance score read as 0.
     */
    public ArticleDocument toDocument() {
        Set<String> categories = new LinkedHashSet<>();
        if (category != null) {
            category.stream()
                    .filter(c -> c != null && !c.isBlank())
                    .map(c -> c.trim().toLowerCase(Locale.ROOT))
                    .forEach(categories::add);
        }

        return ArticleDocument.builder()
                .id(id)
                .title(title)
                .description(description)
                .url(url)
                .publishTime(parsePublishTime(publicationDate))
                .source(sourceName)
                .categories(List.copyOf(categories))
                .relevanceScore(relevanceScore != null ? relevanceScore : 0.0)
                .location(latitude != null && longitude != null
                        ? new ArticleDocument.Location(latitude, longitude) : null)
                .summary(llmSummary)
                .build();
    }

    /**
     * ISO instants, or local date-times and plain dates read as UTC
     *
     * @throws DateTimeParseException when the value is none of these
     */
    static Instant parsePublishTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            if (value.indexOf('T') < 0) {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        }
    }
}
