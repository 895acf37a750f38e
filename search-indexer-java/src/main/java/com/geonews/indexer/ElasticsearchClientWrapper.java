package com.geonews.indexer;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkOperation;
import co.elastic.clients.elasticsearch.indices.CreateIndexResponse;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geonews.indexer.model.ArticleDocument;
import org.apache.http.HttpHost;
import org.elasticsearch.client.RestClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Elasticsearch client wrapper for news article indexing
 */
public class ElasticsearchClientWrapper implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ElasticsearchClientWrapper.class);

    static final String NORMALIZER = "lowercase_normalizer";

    private final RestClient restClient;
    private final ElasticsearchTransport transport;
    private final ElasticsearchClient client;
    private final String indexName;

    public ElasticsearchClientWrapper(String host, int port, String indexName, ObjectMapper objectMapper) {
        this.indexName = indexName;
        this.restClient = RestClient.builder(new HttpHost(host, port, "http")).build();
        this.transport = new RestClientTransport(restClient, new JacksonJsonpMapper(objectMapper));
        this.client = new ElasticsearchClient(transport);

        logger.info("Connected to Elasticsearch at {}:{}", host, port);
    }

    /**
     * Create the news index. Categories and source are lowercase-normalized keywords so
     * exact filters ignore case; location is a geo_point for bounding-box filters.
     */
    public void createIndex() throws IOException {
        boolean exists = client.indices().exists(e -> e.index(indexName)).value();
        if (exists) {
            logger.info("Index {} already exists", indexName);
            return;
        }

        CreateIndexResponse response = client.indices().create(c -> c
                .index(indexName)
                .settings(s -> s
                        .numberOfShards("1")
                        .numberOfReplicas("0")
                        .analysis(a -> a
                                .normalizer(NORMALIZER, n -> n
                                        .custom(cn -> cn.filter("lowercase", "asciifolding")))))
                .mappings(m -> m
                        .properties("id", p -> p.keyword(k -> k))
                        .properties("url", p -> p.keyword(k -> k))
                        .properties("title", p -> p.text(t -> t.analyzer("english")))
                        .properties("description", p -> p.text(t -> t.analyzer("english")))
                        .properties("summary", p -> p.text(t -> t.index(false)))
                        .properties("source", p -> p.keyword(k -> k.normalizer(NORMALIZER)))
                        .properties("categories", p -> p.keyword(k -> k.normalizer(NORMALIZER)))
                        .properties("publishTime", p -> p.date(d -> d))
                        .properties("relevanceScore", p -> p.double_(d -> d))
                        .properties("location", p -> p.geoPoint(g -> g))));

        logger.info("Created index {}: acknowledged={}", indexName, response.acknowledged());
    }

    /**
     * Bulk index articles, keyed by id so re-indexing replaces
     *
     * @return number of articles that failed
     */
    public int bulkIndexArticles(List<ArticleDocument> articles) throws IOException {
        if (articles.isEmpty()) {
            return 0;
        }

        List<BulkOperation> operations = articles.stream()
                .map(article -> BulkOperation.of(op -> op
                        .index(idx -> idx
                                .index(indexName)
                                .id(article.getId())
                                .document(article))))
                .toList();

        BulkResponse response = client.bulk(b -> b.operations(operations));

        if (response.errors()) {
            List<String> reasons = response.items().stream()
                    .filter(item -> item.error() != null)
                    .map(item -> item.id() + ": " + item.error().reason())
                    .toList();
            reasons.forEach(reason -> logger.error("Bulk item failed: {}", reason));
            return reasons.size();
        }
        logger.info("Bulk indexed {} articles in {}ms", articles.size(), response.took());
        return 0;
    }

    public long getDocumentCount() throws IOException {
        return client.count(c -> c.index(indexName)).count();
    }

    @Override
    public void close() throws IOException {
        transport.close();
        restClient.close();
        logger.info("Elasticsearch client closed");
    }
}
