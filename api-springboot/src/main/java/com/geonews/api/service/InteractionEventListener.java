package com.geonews.api.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geonews.api.exception.InvalidInputException;
import com.geonews.api.model.InteractionRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Consumes interaction events published to Kafka. Malformed or unknown events are logged and skipped.
 */
@Component
@ConditionalOnProperty(prefix = "geonews.kafka", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class InteractionEventListener {

    private final InteractionService interactionService;
    private final ObjectMapper objectMapper;

    @KafkaListener(topics = "${geonews.kafka.interactions-topic}", groupId = "geonews-api")
    public void onInteraction(String payload) {
        try {
            InteractionRequest request = objectMapper.readValue(payload, InteractionRequest.class);
            interactionService.record(request);
        } catch (JsonProcessingException e) {
            log.error("Error parsing interaction event: {}", e.getMessage());
        } catch (InvalidInputException e) {
            log.warn("Rejected interaction event: {}", e.getMessage());
        } catch (IOException e) {
            log.error("Error recording interaction event: {}", e.getMessage(), e);
        }
    }
}
