package com.quarry.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Backend answer to a partition-discovery request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PartitionResponse {

    /**
     * Disjoint {@code [start, end]} pairs in microseconds, time ordered.
     */
    private List<List<Long>> partitions;

    @JsonProperty("histogram_interval")
    private Long histogramInterval;

    /**
     * Null when the backend does not report eligibility; only an explicit false disables histograms.
     */
    @JsonProperty("is_histogram_eligible")
    private Boolean histogramEligible;

    public List<List<Long>> getPartitions() {
        return partitions != null ? partitions : List.of();
    }

    public boolean isIneligible() {
        return Boolean.FALSE.equals(histogramEligible);
    }
}
