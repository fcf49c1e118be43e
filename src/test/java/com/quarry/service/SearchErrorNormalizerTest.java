package com.quarry.service;

import com.quarry.backend.SearchBackendException;
import com.quarry.config.QuarryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SearchErrorNormalizer.
 */
class SearchErrorNormalizerTest {

    private QuarryProperties properties;
    private SearchErrorNormalizer normalizer;

    @BeforeEach
    void setUp() {
        properties = new QuarryProperties();
        normalizer = new SearchErrorNormalizer(new SearchErrorMessages(properties));
    }

    @Test
    void testKnownCodeIsRemappedAndDetailAppended() {
        SearchBackendException error = new SearchBackendException(
                400, "Bad Request", 20004, "sql parse error", "near WHERE", null);

        assertEquals("Search SQL is not valid ( near WHERE ) ", normalizer.normalize(error).getMessage());
    }

    @Test
    void testBackendMessageIsUsedForUnknownCode() {
        SearchBackendException error = new SearchBackendException(
                400, "Bad Request", 99999, "stream is locked", null, null);

        assertEquals("stream is locked", normalizer.normalize(error).getMessage());
    }

    @Test
    void testStatusTextWithoutBody() {
        SearchBackendException error = new SearchBackendException(
                502, "Bad Gateway", null, null, null, null);

        assertEquals("Bad Gateway", normalizer.normalize(error).getMessage());
    }

    @Test
    void testConfiguredMessagesOverrideDefaults() {
        properties.getBackend().getErrorMessages().put(20004, "Check your query");
        normalizer = new SearchErrorNormalizer(new SearchErrorMessages(properties));

        SearchBackendException error = new SearchBackendException(400, "Bad Request", 20004, null, null, null);

        assertEquals("Check your query", normalizer.normalize(error).getMessage());
    }

    @Test
    void testTimeoutAndOtherErrors() {
        assertEquals("Search request timed out", normalizer.normalize(new TimeoutException()).getMessage());
        assertEquals("boom", normalizer.normalize(new IllegalStateException("boom")).getMessage());

        QueryExecutionException existing = new QueryExecutionException("already normalized");
        assertSame(existing, normalizer.normalize(existing));
    }
}
