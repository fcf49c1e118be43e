package com.quarry.service;

import com.quarry.backend.FakeSearchBackend;
import com.quarry.backend.SearchBackendException;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DatasourceHealthService.
 */
class DatasourceHealthServiceTest {

    @Test
    void testReachableBackend() {
        FakeSearchBackend backend = new FakeSearchBackend();

        StepVerifier.create(new DatasourceHealthService(backend).check())
                .assertNext(health -> assertEquals("success", health.getStatus()))
                .verifyComplete();
    }

    @Test
    void testUnreachableBackendReportsError() {
        FakeSearchBackend backend = new FakeSearchBackend();
        backend.ping = Mono.error(new SearchBackendException(401, "Unauthorized", null, "invalid token", null, null));

        StepVerifier.create(new DatasourceHealthService(backend).check())
                .assertNext(health -> {
                    assertEquals("error", health.getStatus());
                    assertTrue(health.getMessage().contains("(invalid token)"));
                })
                .verifyComplete();
    }
}
