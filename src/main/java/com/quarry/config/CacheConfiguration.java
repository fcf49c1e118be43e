package com.quarry.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.quarry.model.StreamFieldSet;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Cache configuration for Caffeine.
 */
@Configuration
public class CacheConfiguration {

    private final QuarryProperties properties;

    public CacheConfiguration(QuarryProperties properties) {
        this.properties = properties;
    }

    /**
     * Stream schemas keyed by {@code organization/stream}.
     */
    @Bean
    public Cache<String, StreamFieldSet> streamSchemaCache() {
        return Caffeine.newBuilder()
                .maximumSize(properties.getSchemaCache().getMaxSize())
                .expireAfterWrite(properties.getSchemaCache().getExpireAfterWrite())
                .recordStats()
                .build();
    }
}
