package com.quarry.service.cache;

import com.quarry.backend.SearchBackend;
import com.quarry.config.QuarryProperties;
import com.quarry.model.CacheSlotSnapshot;
import com.quarry.model.DisplayMode;
import com.quarry.model.QueryContext;
import com.quarry.model.QueryTarget;
import com.quarry.model.ResultFrame;
import com.quarry.model.SearchRequest;
import com.quarry.model.StreamFieldSet;
import com.quarry.model.TimeRange;
import com.quarry.service.PartitionedHistogramFetcher;
import com.quarry.service.QueryExecutionException;
import com.quarry.service.SearchErrorNormalizer;
import com.quarry.service.frame.ResponseShaper;
import com.quarry.service.query.QueryBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Central coordinator: one target in, one frame out, at most one backend round trip per key.
 *
 * Two independent slots: {@code primary} for regular targets and {@code histogram} for derived
 * log-volume targets. Graph targets and log-volume targets go through the partitioned histogram
 * path; everything else is a direct search shaped as logs.
 *
 * Failures on the direct path reject the shared result with a normalized message. The histogram
 * path never fails; it degrades to an empty graph.
 */
@Slf4j
@Service
public class DispatchCache {

    private final CacheSlot primarySlot = new CacheSlot("primary");
    private final CacheSlot histogramSlot = new CacheSlot("histogram");

    private final QueryBuilder queryBuilder;
    private final CacheKeyGenerator keyGenerator;
    private final SearchBackend searchBackend;
    private final PartitionedHistogramFetcher histogramFetcher;
    private final ResponseShaper responseShaper;
    private final SearchErrorNormalizer errorNormalizer;
    private final QuarryProperties properties;

    public DispatchCache(QueryBuilder queryBuilder,
                         CacheKeyGenerator keyGenerator,
                         SearchBackend searchBackend,
                         PartitionedHistogramFetcher histogramFetcher,
                         ResponseShaper responseShaper,
                         SearchErrorNormalizer errorNormalizer,
                         QuarryProperties properties) {
        this.queryBuilder = queryBuilder;
        this.keyGenerator = keyGenerator;
        this.searchBackend = searchBackend;
        this.histogramFetcher = histogramFetcher;
        this.responseShaper = responseShaper;
        this.errorNormalizer = errorNormalizer;
        this.properties = properties;
    }

    /**
     * Resolve one target.
     *
     * @param target interpolated target
     * @param range query range in microseconds
     * @param streamFields field set snapshot for this batch
     * @param context screen the batch came from
     * @param companion for a log-volume target, the regular target it was derived from; may be null
     * @return the frame, shared with every concurrent caller for the same key
     */
    public Mono<ResultFrame> resolve(QueryTarget target, TimeRange range, StreamFieldSet streamFields,
                                     QueryContext context, QueryTarget companion) {
        boolean volume = isVolumeTarget(target);
        SearchRequest request = buildRequest(target, range, streamFields, context, volume ? companion : null);
        if (volume) {
            request = request.forHistogram();
        }

        DisplayMode displayMode = target.getDisplayMode();
        String key = keyGenerator.generate(request, displayMode, target.getRefId());
        CacheSlot slot = volume ? histogramSlot : primarySlot;
        String timestampColumn = properties.getQuery().getTimestampColumn();

        if (volume || displayMode == DisplayMode.GRAPH) {
            SearchRequest histogramRequest = request;
            return slot.acquire(key,
                    () -> histogramFetcher.fetch(target, histogramRequest, timestampColumn),
                    () -> Mono.just(responseShaper.toGraphFrame(List.of(), target, timestampColumn)));
        }

        SearchRequest searchRequest = request;
        return slot.acquire(key,
                () -> fetchLogs(target, searchRequest, streamFields, timestampColumn),
                () -> Mono.error(new QueryExecutionException("Search query was cancelled")));
    }

    private SearchRequest buildRequest(QueryTarget target, TimeRange range, StreamFieldSet streamFields,
                                       QueryContext context, QueryTarget companion) {
        if (companion != null) {
            log.debug("Target {} reuses the request of companion {}", target.getRefId(), companion.getRefId());
            return queryBuilder.build(companion, range, streamFields, context);
        }
        return queryBuilder.build(target, range, streamFields, context);
    }

    private Mono<ResultFrame> fetchLogs(QueryTarget target, SearchRequest request,
                                        StreamFieldSet streamFields, String timestampColumn) {
        return searchBackend.search(target.getOrganization(), request)
                .timeout(properties.getQuery().getTimeout())
                .map(response -> responseShaper.toLogsFrame(response.getHits(), target, streamFields, timestampColumn))
                .doOnError(error -> log.error("Search failed for target {}: {}", target.getRefId(), error.getMessage()))
                .onErrorMap(errorNormalizer::normalize);
    }

    public boolean isVolumeTarget(QueryTarget target) {
        String refId = target.getRefId();
        return refId != null && refId.startsWith(properties.getQuery().getLogVolumeRefIdPrefix());
    }

    /**
     * Empty both slots, cancelling any fetch in flight.
     */
    public void clear() {
        primarySlot.clear();
        histogramSlot.clear();
        log.info("Dispatch cache cleared");
    }

    public List<CacheSlotSnapshot> snapshot() {
        return List.of(primarySlot.snapshot(), histogramSlot.snapshot());
    }

    CacheSlot primarySlot() {
        return primarySlot;
    }

    CacheSlot histogramSlot() {
        return histogramSlot;
    }
}
