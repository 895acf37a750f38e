package com.geonews.api.model;

import java.util.List;

/**
 * Output of the external NLP provider.
 */
public record NlpAnalysis(List<Entity> entities, double confidence) {

    public record Entity(String text, String type) {
    }
}
