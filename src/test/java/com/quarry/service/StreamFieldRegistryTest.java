package com.quarry.service;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.quarry.backend.FakeSearchBackend;
import com.quarry.model.StreamField;
import com.quarry.model.StreamFieldSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StreamFieldRegistry.
 */
class StreamFieldRegistryTest {

    private FakeSearchBackend backend;
    private StreamFieldRegistry registry;

    @BeforeEach
    void setUp() {
        backend = new FakeSearchBackend();
        registry = new StreamFieldRegistry(backend, Caffeine.newBuilder().build());
    }

    @Test
    void testUpdateReplacesFieldSet() {
        assertTrue(registry.current().isEmpty());

        registry.update(List.of(new StreamField("level", "Utf8"), new StreamField("level", "Int64")));

        assertEquals(1, registry.current().size());
        assertTrue(registry.current().contains("level"));
    }

    @Test
    void testRefreshLoadsSchemaOnceAndCaches() {
        StreamFieldSet schema = StreamFieldSet.of(List.of(new StreamField("code", "Int64")));
        backend.schema = Mono.just(schema);

        StepVerifier.create(registry.refresh("org", "default")).expectNext(schema).verifyComplete();
        registry.update(List.of());
        StepVerifier.create(registry.refresh("org", "default")).expectNext(schema).verifyComplete();

        assertEquals(1, backend.schemaCalls.get());
        assertEquals(schema, registry.current());

        registry.invalidateSchemas();
        registry.refresh("org", "default").block();
        assertEquals(2, backend.schemaCalls.get());
    }
}
