package com.geonews.api.store;

import com.geonews.api.model.Article;
import com.geonews.api.model.ArticlePredicates;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Article store held in process memory, filled from the bundled seed file.
 */
@Component
@ConditionalOnProperty(prefix = "geonews.store", name = "type", havingValue = "memory", matchIfMissing = true)
@Slf4j
public class InMemoryArticleStore implements ArticleStore {

    private final Map<String, Article> articles = new ConcurrentHashMap<>();

    /**
     * Adds an article unless one with the same id already exists
     *
     * @return true if the article was added
     */
    public boolean save(Article article) {
        boolean added = articles.putIfAbsent(article.getId(), article) == null;
        if (!added) {
            log.debug("Article {} already present, skipping", article.getId());
        }
        return added;
    }

    @Override
    public List<Article> query(ArticlePredicates predicates) {
        return articles.values().stream()
                .filter(predicates::matches)
                .toList();
    }

    @Override
    public Optional<Article> findById(String id) {
        return Optional.ofNullable(articles.get(id));
    }

    @Override
    public long count() {
        return articles.size();
    }
}
