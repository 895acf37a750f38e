package com.geonews.api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine tuning bound from the {@code geonews.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "geonews")
public class GeoNewsProperties {

    private Store store = new Store();
    private Nlp nlp = new Nlp();
    private Intent intent = new Intent();
    private Retrieval retrieval = new Retrieval();
    private Trending trending = new Trending();
    private Kafka kafka = new Kafka();
    private Simulator simulator = new Simulator();

    @Data
    public static class Store {
        /** {@code memory} or {@code elasticsearch} */
        private String type = "memory";
        private String seedFile = "data/news_data.json";
        private String index = "news_articles";
        /** Upper bound on documents pulled from Elasticsearch per query */
        private int maxCandidates = 500;
    }

    @Data
    public static class Nlp {
        private String url = "https://language.googleapis.com/v1";
        private String apiKey = "";
        private Duration timeout = Duration.ofSeconds(2);
        private double confidence = 0.85;
        private double minSalience = 0.1;
    }

    @Data
    public static class Intent {
        private List<String> categories = new ArrayList<>(List.of(
                "technology", "business", "sports", "politics", "entertainment",
                "science", "health", "world", "general"));
        private List<String> sources = new ArrayList<>(List.of(
                "Reuters", "BBC News", "CNN", "The Hindu", "Times of India",
                "Hindustan Times", "NDTV", "The New York Times"));
        /** Short names mapped to the source they stand for */
        private Map<String, String> sourceAliases = new LinkedHashMap<>(Map.of(
                "BBC", "BBC News",
                "TOI", "Times of India",
                "NYT", "The New York Times",
                "HT", "Hindustan Times"));
        private List<String> locations = new ArrayList<>(List.of(
                "Mumbai", "Delhi", "New Delhi", "Bengaluru", "Bangalore", "Chennai",
                "Kolkata", "Hyderabad", "Pune", "London", "New York"));
    }

    @Data
    public static class Retrieval {
        private int defaultLimit = 5;
        private int maxLimit = 50;
        private double nearbyRadiusKm = 10.0;
        private double scoreThreshold = 0.7;
    }

    @Data
    public static class Trending {
        private Duration ttl = Duration.ofMinutes(5);
        private Duration sweepInterval = Duration.ofMinutes(1);
        /** Interactions older than this do not contribute to a score */
        private Duration interactionWindow = Duration.ofHours(48);
        private int executorThreads = 4;
    }

    @Data
    public static class Kafka {
        private boolean enabled = false;
        private String interactionsTopic = "user-interactions";
    }

    @Data
    public static class Simulator {
        private boolean enabled = true;
        private int maxArticles = 50;
        private long seed = 0L;
    }
}
