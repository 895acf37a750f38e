package com.geonews.api.store;

import com.geonews.api.model.Article;
import com.geonews.api.model.ArticlePredicates;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Read access to the persisted article set. Results are unordered; ranking is the caller's job.
 */
public interface ArticleStore {

    List<Article> query(ArticlePredicates predicates) throws IOException;

    Optional<Article> findById(String id) throws IOException;

    long count() throws IOException;
}
