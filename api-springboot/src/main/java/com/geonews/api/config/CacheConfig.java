package com.geonews.api.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Spring Cache setup. Only successful NLP analyses are memoised here; trending
 * results live in {@link com.geonews.api.service.TrendingResultCache}.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String NLP_ANALYSES = "nlpAnalyses";

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager(NLP_ANALYSES);
        manager.setCaffeine(Caffeine.newBuilder()
                .recordStats()
                .maximumSize(5_000)
                .expireAfterWrite(Duration.ofMinutes(30)));
        return manager;
    }
}
