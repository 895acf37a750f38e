package com.geonews.indexer;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.function.Function;

/**
 * Indexer settings read from environment variables
 */
@Value
@Builder
public class IndexerConfig {

    String kafkaBootstrapServers;
    String kafkaTopic;
    String consumerGroup;
    String esHost;
    int esPort;
    String esIndex;
    int batchSize;

    /** Path of a JSON seed file to bulk load before consuming; null to skip */
    String seedFile;

    /** When false, only the seed file is loaded */
    boolean consume;

    public static IndexerConfig fromEnvironment() {
        return from(System.getenv());
    }

    static IndexerConfig from(Map<String, String> env) {
        Function<String, String> optional = name -> {
            String value = env.get(name);
            return value != null && !value.isBlank() ? value : null;
        };
        return IndexerConfig.builder()
                .kafkaBootstrapServers(env.getOrDefault("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                .kafkaTopic(env.getOrDefault("KAFKA_TOPIC", "news-articles"))
                .consumerGroup(env.getOrDefault("KAFKA_CONSUMER_GROUP", "geonews-indexer"))
                .esHost(env.getOrDefault("ELASTICSEARCH_HOST", "localhost"))
                .esPort(Integer.parseInt(env.getOrDefault("ELASTICSEARCH_PORT", "9200")))
                .esIndex(env.getOrDefault("ELASTICSEARCH_INDEX", "news_articles"))
                .batchSize(Integer.parseInt(env.getOrDefault("BATCH_SIZE", "100")))
                .seedFile(optional.apply("SEED_FILE"))
                .consume(Boolean.parseBoolean(env.getOrDefault("CONSUME", "true")))
                .build();
    }
}
