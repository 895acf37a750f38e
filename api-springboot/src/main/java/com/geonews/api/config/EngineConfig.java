package com.geonews.api.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableScheduling
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs trending recomputations so that cache population outlives the request that triggered it.
     */
    @Bean
    public Executor trendingExecutor(GeoNewsProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getTrending().getExecutorThreads());
        executor.setMaxPoolSize(properties.getTrending().getExecutorThreads());
        executor.setQueueCapacity(100);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("Trending-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean
    public WebClient nlpWebClient(WebClient.Builder webClientBuilder, GeoNewsProperties properties) {
        return webClientBuilder.baseUrl(properties.getNlp().getUrl()).build();
    }
}
