package com.geonews.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.io.Serializable;
import java.time.Instant;
import java.util.Set;

/**
 * News article. Everything except the summary is fixed at creation.
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode(of = "id")
@ToString(of = {"id", "title", "source"})
public class Article implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String title;
    private final String description;
    private final String url;
    private final Instant publishTime;
    private final String source;
    @Builder.Default
    private final Set<String> categories = Set.of();
    private final double relevanceScore;
    private final Double latitude;
    private final Double longitude;

    @Setter
    private volatile String summary;

    @JsonIgnore
    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }

    /**
     * Article coordinate, or null when the article is not geotagged
     */
    public GeoPoint location() {
        return GeoPoint.ofNullable(latitude, longitude);
    }

    public boolean inCategory(String category) {
        return category != null && categories.stream().anyMatch(category::equalsIgnoreCase);
    }
}
