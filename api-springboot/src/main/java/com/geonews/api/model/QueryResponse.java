package com.geonews.api.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Response of the natural-language query endpoint
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

    private List<String> entities;
    private Map<String, EntityRole> entityRoles;
    private IntentType intent;
    private double confidence;
    private ResolutionPath resolution;
    private RetrievalStrategy strategy;
    private List<Article> articles;
    private int totalResults;
    private String queryUsed;
}
