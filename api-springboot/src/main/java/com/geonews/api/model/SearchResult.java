package com.geonews.api.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Ranked result wrapper for the retrieval endpoints
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResult<T> {

    private List<T> items;
    private int total;
    private int limit;
    private RetrievalStrategy strategy;
    private String query;
    private Map<String, Object> filtersApplied;
    private long took; // Time in milliseconds
}
