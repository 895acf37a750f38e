package com.geonews.api.controller;

import com.geonews.api.service.InteractionService;
import com.geonews.api.service.LanguageAnalyzer;
import com.geonews.api.service.TrendingResultCache;
import com.geonews.api.store.ArticleStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Health", description = "Service status")
public class HealthController {

    private final ArticleStore articleStore;
    private final InteractionService interactionService;
    private final TrendingResultCache trendingCache;
    private final LanguageAnalyzer languageAnalyzer;
    private final Clock clock;

    @GetMapping("/health")
    @Operation(summary = "Health", description = "Store sizes and dependency status")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", clock.instant());
        body.put("uptimeSeconds", ManagementFactory.getRuntimeMXBean().getUptime() / 1000);
        body.put("nlpConfigured", languageAnalyzer.isConfigured());
        body.put("interactions", interactionService.count());
        body.put("trendingClusters", trendingCache.size());
        try {
            body.put("articles", articleStore.count());
            body.put("status", "healthy");
        } catch (IOException e) {
            log.warn("Article store unreachable: {}", e.getMessage());
            body.put("status", "degraded");
            body.put("storeError", e.getMessage());
        }
        return ResponseEntity.ok(body);
    }
}
