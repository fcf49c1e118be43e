package com.quarry.service;

import com.quarry.backend.SearchBackend;
import com.quarry.config.QuarryProperties;
import com.quarry.model.PartitionResponse;
import com.quarry.model.QueryTarget;
import com.quarry.model.ResultFrame;
import com.quarry.model.SearchRequest;
import com.quarry.model.SearchResponse;
import com.quarry.service.frame.ResponseShaper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fetches histogram rows by splitting the time range into backend-chosen partitions.
 *
 * Flow:
 * 1. Drop the row cap, then discover partitions for the query
 * 2. Ineligible range: empty graph; no partitions: one histogram request for the whole range
 * 3. Otherwise one histogram request per partition, all in flight at once
 * 4. Concatenate rows in partition order and shape them as a graph
 *
 * Any failure, or the histogram deadline passing, yields an empty graph frame.
 */
@Slf4j
@Service
public class PartitionedHistogramFetcher {

    private final SearchBackend searchBackend;
    private final ResponseShaper responseShaper;
    private final QuarryProperties properties;

    public PartitionedHistogramFetcher(SearchBackend searchBackend,
                                       ResponseShaper responseShaper,
                                       QuarryProperties properties) {
        this.searchBackend = searchBackend;
        this.responseShaper = responseShaper;
        this.properties = properties;
    }

    /**
     * Resolve a histogram frame. The returned Mono never errors.
     *
     * @param target target being resolved
     * @param request request whose range is partitioned; its row cap is ignored
     * @param timestampColumn fallback time column for the unpartitioned and empty paths
     */
    public Mono<ResultFrame> fetch(QueryTarget target, SearchRequest request, String timestampColumn) {
        String organization = target.getOrganization();
        SearchRequest baseRequest = request.withoutRowCap();

        return searchBackend.partition(organization, baseRequest.getQuery())
                .defaultIfEmpty(new PartitionResponse())
                .flatMap(partitions -> {
                    if (partitions.isIneligible()) {
                        log.debug("Range not histogram eligible for target {}", target.getRefId());
                        return Mono.just(emptyFrame(target, timestampColumn));
                    }
                    List<long[]> bounds = bounds(partitions);
                    if (bounds.isEmpty()) {
                        log.debug("No partitions for target {}, requesting whole range", target.getRefId());
                        return searchBackend.histogram(organization, baseRequest)
                                .map(response -> responseShaper.toGraphFrame(response.getHits(), target, timestampColumn));
                    }
                    return fetchPartitions(target, baseRequest, bounds, partitions.getHistogramInterval());
                })
                .timeout(properties.getQuery().getHistogramTimeout())
                .onErrorResume(error -> {
                    log.error("Partition or histogram request failed for target {}, returning empty graph",
                            target.getRefId(), error);
                    return Mono.just(emptyFrame(target, timestampColumn));
                });
    }

    private Mono<ResultFrame> fetchPartitions(QueryTarget target, SearchRequest baseRequest,
                                              List<long[]> bounds, Long histogramInterval) {
        log.debug("Fetching {} histogram partitions for target {}", bounds.size(), target.getRefId());

        return Flux.fromIterable(bounds)
                .flatMapSequential(partition -> searchBackend.histogram(
                        target.getOrganization(),
                        baseRequest.forPartition(partition[0], partition[1], histogramInterval)))
                .map(SearchResponse::getHits)
                .collectList()
                .map(PartitionedHistogramFetcher::concat)
                .map(rows -> responseShaper.toGraphFrame(
                        rows, target, properties.getQuery().getHistogramTimestampColumn()));
    }

    private static List<Map<String, Object>> concat(List<List<Map<String, Object>>> pages) {
        List<Map<String, Object>> rows = new ArrayList<>();
        pages.forEach(rows::addAll);
        return rows;
    }

    private static List<long[]> bounds(PartitionResponse response) {
        List<long[]> bounds = new ArrayList<>();
        for (List<Long> partition : response.getPartitions()) {
            if (partition == null || partition.size() < 2 || partition.get(0) == null || partition.get(1) == null) {
                log.warn("Skipping malformed partition {}", partition);
                continue;
            }
            bounds.add(new long[]{partition.get(0), partition.get(1)});
        }
        return bounds;
    }

    private ResultFrame emptyFrame(QueryTarget target, String timestampColumn) {
        return responseShaper.toGraphFrame(List.of(), target, timestampColumn);
    }
}
