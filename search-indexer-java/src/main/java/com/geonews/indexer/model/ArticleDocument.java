package com.geonews.indexer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Article model for Elasticsearch indexing
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArticleDocument {

    private String id;
    private String title;
    private String description;
    private String url;
    private Instant publishTime;
    private String source;
    private List<String> categories;
    private double relevanceScore;

    /** Indexed as geo_point */
    private Location location;

    private String summary;

    public record Location(double lat, double lon) {
    }
}
