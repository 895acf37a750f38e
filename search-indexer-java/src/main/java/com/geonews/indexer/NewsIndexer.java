package com.geonews.indexer;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.geonews.indexer.model.ArticleDocument;
import com.geonews.indexer.model.NewsRecord;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

/**
 * Loads the seed file into Elasticsearch, then indexes articles published to Kafka
 */
public class NewsIndexer {

    private static final Logger logger = LoggerFactory.getLogger(NewsIndexer.class);

    private final IndexerConfig config;
    private final ElasticsearchClientWrapper esClient;
    private final ObjectMapper objectMapper;

    private volatile boolean running = true;

    public NewsIndexer(IndexerConfig config) {
        this.config = config;
        this.objectMapper = createObjectMapper();
        this.esClient = new ElasticsearchClientWrapper(config.getEsHost(), config.getEsPort(), config.getEsIndex(),
                objectMapper);
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return objectMapper;
    }

    private KafkaConsumer<String, String> createConsumer() {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, config.getConsumerGroup());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
        props.put(ConsumerConfig.AUTO_COMMIT_INTERVAL_MS_CONFIG, "5000");
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, String.valueOf(config.getBatchSize()));
        return new KafkaConsumer<>(props);
    }

    public void run() {
        try {
            esClient.createIndex();

            if (config.getSeedFile() != null) {
                loadSeedFile(Path.of(config.getSeedFile()));
            }
            if (config.isConsume()) {
                consume();
            }
        } catch (IOException e) {
            logger.error("Indexer error: {}", e.getMessage(), e);
        } finally {
            try {
                esClient.close();
            } catch (IOException e) {
                logger.error("Error closing ES client: {}", e.getMessage());
            }
        }
    }

    private void loadSeedFile(Path seedFile) throws IOException {
        List<ArticleDocument> documents = new SeedFileReader(objectMapper).read(seedFile);
        for (int from = 0; from < documents.size(); from += config.getBatchSize()) {
            indexBatch(documents.subList(from, Math.min(from + config.getBatchSize(), documents.size())));
        }
        logger.info("Seed file {} loaded, index now holds {} documents", seedFile, esClient.getDocumentCount());
    }

    private void consume() {
        try (KafkaConsumer<String, String> consumer = createConsumer()) {
            consumer.subscribe(Collections.singletonList(config.getKafkaTopic()));
            logger.info("Starting indexer. Listening to topic: {}", config.getKafkaTopic());

            List<ArticleDocument> batch = new ArrayList<>();
            while (running) {
                ConsumerRecords<String, String> records = consumer.poll(Duration.ofSeconds(1));

                for (ConsumerRecord<String, String> record : records) {
                    parse(record.value()).ifPresent(batch::add);
                    if (batch.size() >= config.getBatchSize()) {
                        indexBatch(batch);
                        batch.clear();
                    }
                }

                if (!batch.isEmpty() && records.isEmpty()) {
                    indexBatch(batch);
                    batch.clear();
                }
            }
        }
    }

    /**
     * Empty for malformed or unindexable payloads, which are logged and skipped
     */
    Optional<ArticleDocument> parse(String payload) {
        try {
            NewsRecord record = objectMapper.readValue(payload, NewsRecord.class);
            if (!record.isIndexable()) {
                logger.warn("Skipping article without id or title");
                return Optional.empty();
            }
            return Optional.of(record.toDocument());
        } catch (IOException | RuntimeException e) {
            logger.error("Error parsing article: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void indexBatch(List<ArticleDocument> articles) {
        try {
            int failed = esClient.bulkIndexArticles(articles);
            logger.info("Indexed batch of {} articles, {} failed", articles.size(), failed);
        } catch (IOException e) {
            logger.error("Error indexing batch: {}", e.getMessage());
        }
    }

    public void stop() {
        running = false;
    }

    public static void main(String[] args) {
        IndexerConfig config = IndexerConfig.fromEnvironment();

        logger.info("Starting NewsIndexer with config:");
        logger.info("  Kafka: {}:{}", config.getKafkaBootstrapServers(), config.getKafkaTopic());
        logger.info("  Elasticsearch: {}:{}/{}", config.getEsHost(), config.getEsPort(), config.getEsIndex());
        logger.info("  Batch size: {}, seed file: {}", config.getBatchSize(), config.getSeedFile());

        NewsIndexer indexer = new NewsIndexer(config);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            indexer.stop();
        }));

        indexer.run();
    }
}
