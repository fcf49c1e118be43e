package com.quarry.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.quarry.backend.SearchBackend;
import com.quarry.model.StreamField;
import com.quarry.model.StreamFieldSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the stream field set used to build and shape queries.
 *
 * The set is replaced wholesale; readers take one snapshot per batch.
 */
@Slf4j
@Service
public class StreamFieldRegistry {

    private final AtomicReference<StreamFieldSet> current = new AtomicReference<>(StreamFieldSet.empty());
    private final SearchBackend searchBackend;
    private final Cache<String, StreamFieldSet> schemaCache;

    public StreamFieldRegistry(SearchBackend searchBackend, Cache<String, StreamFieldSet> streamSchemaCache) {
        this.searchBackend = searchBackend;
        this.schemaCache = streamSchemaCache;
    }

    public StreamFieldSet current() {
        return current.get();
    }

    public StreamFieldSet update(List<StreamField> fields) {
        StreamFieldSet updated = StreamFieldSet.of(fields);
        current.set(updated);
        log.info("Stream fields updated: {} fields", updated.size());
        return updated;
    }

    /**
     * Load a stream's schema from the backend (cached) and make it the current field set.
     */
    public Mono<StreamFieldSet> refresh(String organization, String stream) {
        String cacheKey = organization + "/" + stream;
        StreamFieldSet cached = schemaCache.getIfPresent(cacheKey);
        if (cached != null) {
            log.debug("Schema cache hit for {}", cacheKey);
            current.set(cached);
            return Mono.just(cached);
        }

        return searchBackend.streamSchema(organization, stream)
                .doOnNext(fields -> {
                    schemaCache.put(cacheKey, fields);
                    current.set(fields);
                    log.info("Loaded {} fields for stream {}", fields.size(), cacheKey);
                });
    }

    public void invalidateSchemas() {
        schemaCache.invalidateAll();
    }
}
