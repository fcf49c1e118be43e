package com.quarry.service;

import com.quarry.TestFixtures;
import com.quarry.backend.FakeSearchBackend;
import com.quarry.backend.SearchBackendException;
import com.quarry.config.QuarryProperties;
import com.quarry.model.PartitionResponse;
import com.quarry.model.QueryTarget;
import com.quarry.model.SearchQuery;
import com.quarry.model.SearchRequest;
import com.quarry.model.SearchResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static com.quarry.backend.FakeSearchBackend.hits;
import static com.quarry.backend.FakeSearchBackend.partitions;
import static com.quarry.backend.FakeSearchBackend.row;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PartitionedHistogramFetcher.
 */
class PartitionedHistogramFetcherTest {

    private FakeSearchBackend backend;
    private QuarryProperties properties;
    private PartitionedHistogramFetcher fetcher;
    private QueryTarget target;
    private SearchRequest baseRequest;

    @BeforeEach
    void setUp() {
        backend = new FakeSearchBackend();
        properties = new QuarryProperties();
        fetcher = TestFixtures.histogramFetcher(backend, properties);
        target = QueryTarget.builder().refId("log-volume-A").organization("org").stream("default").build();
        baseRequest = SearchRequest.builder()
                .query(SearchQuery.builder()
                        .sql("select * from \"default\"")
                        .startTime(0L)
                        .endTime(20L)
                        .size(300)
                        .build())
                .build();
    }

    @Test
    void testMergePreservesPartitionOrderRegardlessOfCompletionOrder() {
        Sinks.One<SearchResponse> first = Sinks.one();
        Sinks.One<SearchResponse> second = Sinks.one();

        backend.partitionHandler = query -> Mono.just(partitions(60L, new long[]{0, 10}, new long[]{10, 20}));
        backend.histogramHandler = request ->
                request.getQuery().getStartTime() == 0L ? first.asMono() : second.asMono();

        StepVerifier.create(fetcher.fetch(target, baseRequest, "_timestamp"))
                .then(() -> {
                    assertEquals(2, backend.histogramCalls.get(), "partitions must be requested concurrently");
                    second.tryEmitValue(hits(
                            row("zo_sql_key", "2024-01-01T00:00:10", "zo_sql_num", 3)));
                })
                .then(() -> first.tryEmitValue(hits(
                        row("zo_sql_key", "2024-01-01T00:00:00", "zo_sql_num", 1),
                        row("zo_sql_key", "2024-01-01T00:00:05", "zo_sql_num", 2))))
                .assertNext(frame -> {
                    assertEquals(List.of("Time", "zo_sql_num"), frame.getFieldNames());
                    assertEquals(List.of(1, 2, 3), frame.field("zo_sql_num").orElseThrow().getValues());
                })
                .verifyComplete();
    }

    @Test
    void testPartitionRequestsCarryBoundsAndInterval() {
        backend.partitionHandler = query -> Mono.just(partitions(60L, new long[]{0, 10}, new long[]{10, 20}));

        StepVerifier.create(fetcher.fetch(target, baseRequest, "_timestamp"))
                .expectNextCount(1)
                .verifyComplete();

        SearchQuery discovery = backend.partitionQueries.get(0);
        assertNull(discovery.getSize(), "discovery ignores the row cap");
        assertEquals(baseRequest.getQuery().getSql(), discovery.getSql());

        List<SearchQuery> sent = backend.histogramRequests.stream().map(SearchRequest::getQuery).toList();
        assertEquals(2, sent.size());
        assertTrue(sent.stream().anyMatch(q -> q.getStartTime() == 0L && q.getEndTime() == 10L));
        assertTrue(sent.stream().anyMatch(q -> q.getStartTime() == 10L && q.getEndTime() == 20L));
        assertTrue(sent.stream().allMatch(q -> Long.valueOf(60L).equals(q.getHistogramInterval())));
        assertTrue(sent.stream().allMatch(q -> q.getSize() == null), "partition requests carry no row cap");
    }

    @Test
    void testIneligibleRangeReturnsEmptyGraph() {
        backend.partitionHandler = query -> Mono.just(PartitionResponse.builder()
                .partitions(List.of(List.of(0L, 10L)))
                .histogramEligible(false)
                .build());

        StepVerifier.create(fetcher.fetch(target, baseRequest, "_timestamp"))
                .assertNext(frame -> {
                    assertTrue(frame.isEmpty());
                    assertEquals(List.of("Time", "zo_sql_num", "x_axis_1"), frame.getFieldNames());
                })
                .verifyComplete();

        assertEquals(0, backend.histogramCalls.get());
    }

    @Test
    void testNoPartitionsFallsBackToSingleRequest() {
        backend.histogramHandler = request -> Mono.just(hits(row("_timestamp", 1_700_000_000_000_000L, "count", 4)));

        StepVerifier.create(fetcher.fetch(target, baseRequest, "_timestamp"))
                .assertNext(frame -> assertEquals(List.of(1_700_000_000_000L),
                        frame.field("Time").orElseThrow().getValues()))
                .verifyComplete();

        assertEquals(1, backend.histogramCalls.get());
        SearchQuery sent = backend.histogramRequests.get(0).getQuery();
        assertNull(sent.getSize());
        assertEquals(baseRequest.getQuery().getSql(), sent.getSql());
        assertEquals(0L, sent.getStartTime());
        assertEquals(20L, sent.getEndTime());
    }

    @Test
    void testAnyPartitionFailureDegradesWholeMerge() {
        backend.partitionHandler = query -> Mono.just(partitions(60L, new long[]{0, 10}, new long[]{10, 20}));
        backend.histogramHandler = request -> request.getQuery().getStartTime() == 0L
                ? Mono.just(hits(row("zo_sql_key", "2024-01-01T00:00:00", "zo_sql_num", 1)))
                : Mono.error(new SearchBackendException(500, "Internal Server Error", null, null, null, null));

        StepVerifier.create(fetcher.fetch(target, baseRequest, "_timestamp"))
                .assertNext(frame -> assertTrue(frame.isEmpty()))
                .verifyComplete();
    }

    @Test
    void testDiscoveryFailureDegradesToEmptyGraph() {
        backend.partitionHandler = query -> Mono.error(
                new SearchBackendException(503, "Service Unavailable", null, null, null, null));

        StepVerifier.create(fetcher.fetch(target, baseRequest, "_timestamp"))
                .assertNext(frame -> assertTrue(frame.isEmpty()))
                .verifyComplete();
    }

    @Test
    void testDeadlineDegradesToEmptyGraph() {
        properties.getQuery().setHistogramTimeout(Duration.ofMillis(50));
        backend.partitionHandler = query -> Mono.just(partitions(60L, new long[]{0, 10}));
        backend.histogramHandler = request -> Mono.never();

        StepVerifier.create(fetcher.fetch(target, baseRequest, "_timestamp"))
                .assertNext(frame -> assertTrue(frame.isEmpty()))
                .verifyComplete();
    }

    @Test
    void testMalformedPartitionsAreSkipped() {
        backend.partitionHandler = query -> Mono.just(PartitionResponse.builder()
                .partitions(List.of(List.of(0L), List.of(0L, 20L)))
                .histogramInterval(10L)
                .build());
        backend.histogramHandler = request -> Mono.just(hits(
                row("zo_sql_key", "2024-01-01T00:00:00", "zo_sql_num", 9)));

        StepVerifier.create(fetcher.fetch(target, baseRequest, "_timestamp"))
                .assertNext(frame -> assertEquals(List.of(9), frame.field("zo_sql_num").orElseThrow().getValues()))
                .verifyComplete();

        assertEquals(1, backend.histogramCalls.get());
    }
}
