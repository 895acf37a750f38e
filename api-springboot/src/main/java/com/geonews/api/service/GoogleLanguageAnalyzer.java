package com.geonews.api.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.geonews.api.config.CacheConfig;
import com.geonews.api.config.GeoNewsProperties;
import com.geonews.api.exception.NlpUnavailableException;
import com.geonews.api.model.NlpAnalysis;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entity extraction via the Google Cloud Natural Language REST API ({@code documents:analyzeEntities}).
 */
@Service
@Slf4j
public class GoogleLanguageAnalyzer implements LanguageAnalyzer {

    private final WebClient webClient;
    private final String apiKey;
    private final Duration timeout;
    private final double confidence;
    private final double minSalience;

    public GoogleLanguageAnalyzer(@Qualifier("nlpWebClient") WebClient webClient, GeoNewsProperties properties) {
        this.webClient = webClient;
        this.apiKey = properties.getNlp().getApiKey();
        this.timeout = properties.getNlp().getTimeout();
        this.confidence = properties.getNlp().getConfidence();
        this.minSalience = properties.getNlp().getMinSalience();
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Successful analyses are cached per text; failures are not.
     */
    @Override
    @Cacheable(CacheConfig.NLP_ANALYSES)
    public NlpAnalysis analyze(String text) throws NlpUnavailableException {
        if (!isConfigured()) {
            throw new NlpUnavailableException("NLP API key is not configured");
        }

        JsonNode response;
        try {
            response = webClient.post()
                    .uri(uri -> uri.path("/documents:analyzeEntities").queryParam("key", apiKey).build())
                    .bodyValue(Map.of(
                            "document", Map.of("type", "PLAIN_TEXT", "content", text),
                            "encodingType", "UTF8"))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(timeout);
        } catch (Exception e) {
            throw new NlpUnavailableException("NLP request failed: " + e.getMessage(), e);
        }

        if (response == null || !response.has("entities")) {
            throw new NlpUnavailableException("Invalid NLP response format");
        }

        NlpAnalysis analysis = new NlpAnalysis(parseEntities(response.get("entities")), confidence);
        log.debug("NLP extracted {} entities from query of length {}", analysis.entities().size(), text.length());
        return analysis;
    }

    List<NlpAnalysis.Entity> parseEntities(JsonNode entitiesNode) {
        List<NlpAnalysis.Entity> entities = new ArrayList<>();
        for (JsonNode node : entitiesNode) {
            String name = node.path("name").asText(null);
            double salience = node.path("salience").asDouble(0.0);
            if (name != null && !name.isBlank() && salience > minSalience) {
                entities.add(new NlpAnalysis.Entity(name, node.path("type").asText("OTHER")));
            }
        }
        return entities;
    }
}
