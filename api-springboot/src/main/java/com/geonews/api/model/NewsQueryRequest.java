package com.geonews.api.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Body of the natural-language query endpoint. Category, source and score bounds
 * are optional structured predicates; supplying any of them skips intent-based selection.
 */
public record NewsQueryRequest(
        @NotBlank String query,
        @DecimalMin("-90.0") @DecimalMax("90.0") Double userLatitude,
        @DecimalMin("-180.0") @DecimalMax("180.0") Double userLongitude,
        @Positive Double radius,
        @Min(1) @Max(50) Integer limit,
        String category,
        String source,
        @DecimalMin("0.0") @DecimalMax("1.0") Double minScore,
        @DecimalMin("0.0") @DecimalMax("1.0") Double maxScore) {
}
