package com.spendradar.categorization.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.spendradar.categorization.remote.OpenAiChatCategoryClassifier;
import com.spendradar.categorization.remote.RemoteCategoryClassifier;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Categorization wiring: immutable settings, remote classifier client, its rate limiter and answer cache.
 */
@Configuration
@EnableConfigurationProperties(CategorizationProperties.class)
@Slf4j
public class CategorizationConfig {

    @Bean
    public CategorizationSettings categorizationSettings(CategorizationProperties properties) {
        CategorizationSettings settings = CategorizationSettings.from(properties);
        log.info("Categorization settings: fuzzyThreshold={}, minConfidence={}, remote={}",
                settings.fuzzyThreshold(), settings.minConfidence(), settings.remote());
        return settings;
    }

    @Bean(name = "remoteClassifierRateLimiter")
    public RateLimiter remoteClassifierRateLimiter(CategorizationSettings settings) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(settings.remote().requestsPerSecond())
                .timeoutDuration(settings.remote().timeout())
                .build();
        return RateLimiter.of("remote-classifier", config);
    }

    @Bean
    public RemoteCategoryClassifier remoteCategoryClassifier(WebClient.Builder webClientBuilder,
                                                             CategorizationSettings settings,
                                                             RateLimiter remoteClassifierRateLimiter) {
        return new OpenAiChatCategoryClassifier(webClientBuilder, settings.remote(), remoteClassifierRateLimiter);
    }

    @Bean(name = "remoteAnswerCache")
    public Cache<String, String> remoteAnswerCache(CategorizationSettings settings) {
        Duration ttl = settings.remote().cacheTtl();
        if (ttl.isZero()) {
            return Caffeine.newBuilder().maximumSize(0).build();
        }
        return Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(10_000)
                .build();
    }
}
