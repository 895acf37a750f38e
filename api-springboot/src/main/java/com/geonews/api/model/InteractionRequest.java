package com.geonews.api.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;

import java.time.Instant;

/**
 * Wire form of an interaction, shared by the REST endpoint and the Kafka listener.
 */
public record InteractionRequest(
        @NotBlank String articleId,
        String userId,
        @NotBlank String type,
        Instant timestamp,
        @DecimalMin("-90.0") @DecimalMax("90.0") Double userLatitude,
        @DecimalMin("-180.0") @DecimalMax("180.0") Double userLongitude) {
}
