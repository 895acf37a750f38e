package com.geonews.api.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geonews.api.config.GeoNewsProperties;
import com.geonews.api.model.Article;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads the bundled article data set into the in-memory store at startup.
 */
@Component
@Order(1)
@ConditionalOnProperty(prefix = "geonews.store", name = "type", havingValue = "memory", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ArticleSeedLoader implements ApplicationRunner {

    private final InMemoryArticleStore store;
    private final ObjectMapper objectMapper;
    private final GeoNewsProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        String seedFile = properties.getStore().getSeedFile();
        try {
            int loaded = load(new ClassPathResource(seedFile));
            log.info("Loaded {} news articles from {}", loaded, seedFile);
        } catch (IOException e) {
            log.error("Error loading news data from {}: {}", seedFile, e.getMessage(), e);
        }
    }

    /**
     * Reads a JSON array of articles and saves the ones not already present
     *
     * @return number of articles added
     */
    public int load(Resource resource) throws IOException {
        List<SeedArticle> seed;
        try (InputStream in = resource.getInputStream()) {
            seed = objectMapper.readValue(in, new TypeReference<List<SeedArticle>>() {
            });
        }

        int added = 0;
        for (SeedArticle item : seed) {
            if (item.id() == null || item.title() == null) {
                log.warn("Skipping seed article without id or title: {}", item.url());
                continue;
            }
            Article article;
            try {
                article = toArticle(item);
            } catch (DateTimeParseException e) {
                log.warn("Skipping seed article {} with unreadable publication date '{}'", item.id(), item.publicationDate());
                continue;
            }
            if (store.save(article)) {
                added++;
            }
        }
        return added;
    }

    static Article toArticle(SeedArticle item) {
        Set<String> categories = item.category() == null ? Set.of() : new LinkedHashSet<>(item.category());
        return Article.builder()
                .id(item.id())
                .title(item.title())
                .description(item.description())
                .url(item.url())
                .publishTime(parseInstant(item.publicationDate()))
                .source(item.sourceName())
                .categories(Set.copyOf(categories))
                .relevanceScore(item.relevanceScore() != null ? item.relevanceScore() : 0.0)
                .latitude(item.latitude())
                .longitude(item.longitude())
                .summary(item.llmSummary())
                .build();
    }

    /**
     * Accepts ISO instants, zone-less local date-times and plain dates, the last two read as UTC
     *
     * @throws DateTimeParseException when the value is none of these
     */
    static Instant parseInstant(String value) {
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

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SeedArticle(
            String id,
            String title,
            String description,
            String url,
            @JsonProperty("publication_date") String publicationDate,
            @JsonProperty("source_name") String sourceName,
            List<String> category,
            @JsonProperty("relevance_score") Double relevanceScore,
            Double latitude,
            Double longitude,
            @JsonProperty("llm_summary") String llmSummary) {
    }
}
