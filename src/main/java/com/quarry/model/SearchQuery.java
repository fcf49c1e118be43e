package com.quarry.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The {@code query} object of a backend search payload.
 * Also posted bare to the partition endpoint.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SearchQuery {

    public static final String SQL_MODE_FULL = "full";
    public static final String SQL_MODE_CONTEXT = "context";

    private String sql;

    @JsonProperty("start_time")
    private long startTime;

    @JsonProperty("end_time")
    private long endTime;

    /**
     * Row cap; null means no cap is sent.
     */
    private Integer size;

    @JsonProperty("sql_mode")
    private String sqlMode;

    @JsonProperty("histogram_interval")
    private Long histogramInterval;
}
