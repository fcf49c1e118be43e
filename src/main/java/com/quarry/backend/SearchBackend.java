package com.quarry.backend;

import com.quarry.model.PartitionResponse;
import com.quarry.model.SearchQuery;
import com.quarry.model.SearchRequest;
import com.quarry.model.SearchResponse;
import com.quarry.model.StreamFieldSet;
import reactor.core.publisher.Mono;

/**
 * Transport to a log-search backend.
 * Implementations signal failures as {@link SearchBackendException}.
 */
public interface SearchBackend {

    /**
     * Get backend name, used in logs.
     *
     * @return backend name
     */
    String getName();

    /**
     * Run a search and return its rows.
     *
     * @param organization owning organization id
     * @param request search payload
     * @return backend response
     */
    Mono<SearchResponse> search(String organization, SearchRequest request);

    /**
     * Run a search flagged as a UI histogram query.
     *
     * @param organization owning organization id
     * @param request search payload, usually restricted to one partition
     * @return backend response
     */
    Mono<SearchResponse> histogram(String organization, SearchRequest request);

    /**
     * Ask the backend how to split a query's time range into histogram partitions.
     *
     * @param organization owning organization id
     * @param query bare query object, without a row cap
     * @return partition boundaries and the aligned histogram interval
     */
    Mono<PartitionResponse> partition(String organization, SearchQuery query);

    /**
     * Load the known fields of a log stream.
     */
    Mono<StreamFieldSet> streamSchema(String organization, String stream);

    /**
     * Cheap reachability check.
     */
    Mono<Void> ping();
}
