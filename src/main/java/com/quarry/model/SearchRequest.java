package com.quarry.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload sent to the backend {@code _search} endpoint. Compared structurally for cache keys.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

    private SearchQuery query;

    /**
     * Copy suited to histogram queries: no row cap, context sql mode.
     */
    public SearchRequest forHistogram() {
        return toBuilder()
                .query(query.toBuilder()
                        .size(null)
                        .sqlMode(SearchQuery.SQL_MODE_CONTEXT)
                        .build())
                .build();
    }

    public SearchRequest withoutRowCap() {
        return toBuilder()
                .query(query.toBuilder().size(null).build())
                .build();
    }

    /**
     * Copy restricted to one partition's bounds, tagged with the discovered interval.
     */
    public SearchRequest forPartition(long startTime, long endTime, Long histogramInterval) {
        return toBuilder()
                .query(query.toBuilder()
                        .startTime(startTime)
                        .endTime(endTime)
                        .histogramInterval(histogramInterval)
                        .build())
                .build();
    }
}
