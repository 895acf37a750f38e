package com.geonews.api.service;

import com.geonews.api.exception.NlpUnavailableException;
import com.geonews.api.model.NlpAnalysis;

/**
 * External entity/intent extraction capability.
 */
public interface LanguageAnalyzer {

    /**
     * Extracts entities from free text
     *
     * @throws NlpUnavailableException when the provider cannot answer (missing credentials, timeout, error)
     */
    NlpAnalysis analyze(String text) throws NlpUnavailableException;

    boolean isConfigured();
}
