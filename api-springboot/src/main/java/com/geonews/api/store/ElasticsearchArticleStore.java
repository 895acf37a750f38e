package com.geonews.api.store;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.query_dsl.BoolQuery;
import co.elastic.clients.elasticsearch._types.query_dsl.Operator;
import co.elastic.clients.elasticsearch.core.GetResponse;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.json.JsonData;
import com.geonews.api.config.GeoNewsProperties;
import com.geonews.api.model.Article;
import com.geonews.api.model.ArticlePredicates;
import com.geonews.api.model.BoundingBox;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Article store backed by the Elasticsearch index the indexer module maintains.
 */
@Component
@ConditionalOnProperty(prefix = "geonews.store", name = "type", havingValue = "elasticsearch")
@Slf4j
public class ElasticsearchArticleStore implements ArticleStore {

    private final ElasticsearchClient esClient;
    private final String articlesIndex;
    private final int maxCandidates;

    public ElasticsearchArticleStore(ElasticsearchClient esClient, GeoNewsProperties properties) {
        this.esClient = esClient;
        this.articlesIndex = properties.getStore().getIndex();
        this.maxCandidates = properties.getStore().getMaxCandidates();
    }

    @Override
    public List<Article> query(ArticlePredicates predicates) throws IOException {
        BoolQuery boolQuery = buildQuery(predicates);

        SearchResponse<Map> response = esClient.search(s -> s
                .index(articlesIndex)
                .size(maxCandidates)
                .query(q -> q.bool(boolQuery))
                .sort(so -> so.field(f -> f.field("relevanceScore").order(SortOrder.Desc))),
                Map.class);

        log.debug("Elasticsearch query took {}ms, {} hits", response.took(), response.hits().hits().size());

        return response.hits().hits().stream()
                .map(Hit::source)
                .map(this::mapToArticle)
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public Optional<Article> findById(String id) throws IOException {
        GetResponse<Map> response = esClient.get(g -> g
                .index(articlesIndex)
                .id(id),
                Map.class);

        if (!response.found()) {
            return Optional.empty();
        }
        return Optional.ofNullable(mapToArticle(response.source()));
    }

    @Override
    public long count() throws IOException {
        return esClient.count(c -> c.index(articlesIndex)).count();
    }

    BoolQuery buildQuery(ArticlePredicates predicates) {
        BoolQuery.Builder bool = new BoolQuery.Builder();

        // categories and source are keyword fields with a lowercase normalizer
        if (predicates.getCategory() != null) {
            bool.filter(f -> f.term(t -> t.field("categories").value(predicates.getCategory())));
        }
        if (predicates.getSource() != null) {
            bool.filter(f -> f.term(t -> t.field("source").value(predicates.getSource())));
        }
        if (predicates.getText() != null && !predicates.getText().isBlank()) {
            bool.must(m -> m.multiMatch(mm -> mm
                    .query(predicates.getText())
                    .fields("title", "description")
                    .operator(Operator.Or)));
        }
        if (predicates.getMinScore() != null || predicates.getMaxScore() != null) {
            bool.filter(f -> f.range(r -> {
                r.field("relevanceScore");
                if (predicates.getMinScore() != null) {
                    r.gte(JsonData.of(predicates.getMinScore()));
                }
                if (predicates.getMaxScore() != null) {
                    r.lte(JsonData.of(predicates.getMaxScore()));
                }
                return r;
            }));
        }
        if (predicates.isRequireLocation() || predicates.getBoundingBox() != null) {
            bool.filter(f -> f.exists(e -> e.field("location")));
        }
        if (predicates.getBoundingBox() != null) {
            BoundingBox box = predicates.getBoundingBox();
            bool.filter(f -> f.geoBoundingBox(g -> g
                    .field("location")
                    .boundingBox(b -> b.tlbr(t -> t
                            .topLeft(tl -> tl.latlon(ll -> ll.lat(box.maxLatitude()).lon(box.minLongitude())))
                            .bottomRight(br -> br.latlon(ll -> ll.lat(box.minLatitude()).lon(box.maxLongitude())))))));
        }
        return bool.build();
    }

    @SuppressWarnings("unchecked")
    private Article mapToArticle(Map<String, Object> source) {
        if (source == null)
            return null;

        Map<String, Object> location = (Map<String, Object>) source.get("location");
        List<String> categories = (List<String>) source.get("categories");

        return Article.builder()
                .id((String) source.get("id"))
                .title((String) source.get("title"))
                .description((String) source.get("description"))
                .url((String) source.get("url"))
                .publishTime(parseInstant(source.get("publishTime")))
                .source((String) source.get("source"))
                .categories(categories != null ? Set.copyOf(categories) : Set.of())
                .relevanceScore(source.get("relevanceScore") != null
                        ? ((Number) source.get("relevanceScore")).doubleValue() : 0.0)
                .latitude(location != null ? ((Number) location.get("lat")).doubleValue() : null)
                .longitude(location != null ? ((Number) location.get("lon")).doubleValue() : null)
                .summary((String) source.get("summary"))
                .build();
    }

    private Instant parseInstant(Object value) {
        if (value == null)
            return null;
        if (value instanceof Number)
            return Instant.ofEpochMilli(((Number) value).longValue());
        if (value instanceof String)
            return Instant.parse((String) value);
        return null;
    }
}
