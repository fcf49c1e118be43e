package com.quarry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quarry.backend.FakeSearchBackend;
import com.quarry.config.JacksonConfiguration;
import com.quarry.config.QuarryProperties;
import com.quarry.service.PartitionedHistogramFetcher;
import com.quarry.service.SearchErrorMessages;
import com.quarry.service.SearchErrorNormalizer;
import com.quarry.service.cache.CacheKeyGenerator;
import com.quarry.service.cache.DispatchCache;
import com.quarry.service.frame.ResponseShaper;
import com.quarry.service.query.QueryBuilder;

/**
 * Wires the dispatch pipeline by hand around a fake backend.
 */
public final class TestFixtures {

    public static final ObjectMapper MAPPER = JacksonConfiguration.createObjectMapper();

    private TestFixtures() {
    }

    public static ResponseShaper shaper() {
        return new ResponseShaper(MAPPER);
    }

    public static PartitionedHistogramFetcher histogramFetcher(FakeSearchBackend backend, QuarryProperties properties) {
        return new PartitionedHistogramFetcher(backend, shaper(), properties);
    }

    public static DispatchCache dispatchCache(FakeSearchBackend backend, QuarryProperties properties) {
        return new DispatchCache(
                new QueryBuilder(properties),
                new CacheKeyGenerator(MAPPER),
                backend,
                histogramFetcher(backend, properties),
                shaper(),
                new SearchErrorNormalizer(new SearchErrorMessages(properties)),
                properties);
    }
}
