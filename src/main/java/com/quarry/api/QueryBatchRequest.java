package com.quarry.api;

import com.quarry.model.QueryContext;
import com.quarry.model.QueryTarget;
import com.quarry.model.TimeRange;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One rendering pass: targets resolved over a shared time range.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryBatchRequest {

    @NotNull
    @Builder.Default
    private List<QueryTarget> targets = new ArrayList<>();

    @NotNull
    @Valid
    private Range range;

    @Builder.Default
    private QueryContext app = QueryContext.UNKNOWN;

    /**
     * Dashboard variables substituted into target queries.
     */
    @Builder.Default
    private Map<String, String> scopedVars = new HashMap<>();

    /**
     * Epoch milliseconds, as sent by the front-end.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Range {
        @NotNull
        private Long from;
        @NotNull
        private Long to;

        public TimeRange toTimeRange() {
            return TimeRange.ofMillis(from, to);
        }
    }
}
