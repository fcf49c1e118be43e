package com.quarry.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Query time range, normalized to microseconds since the epoch.
 */
@Value
public class TimeRange {

    @JsonProperty("start_time")
    long startMicros;

    @JsonProperty("end_time")
    long endMicros;

    @JsonCreator
    public TimeRange(@JsonProperty("start_time") long startMicros,
                     @JsonProperty("end_time") long endMicros) {
        if (endMicros < startMicros) {
            throw new IllegalArgumentException(
                    "Time range end (" + endMicros + ") is before start (" + startMicros + ")");
        }
        this.startMicros = startMicros;
        this.endMicros = endMicros;
    }

    public static TimeRange ofMillis(long startMillis, long endMillis) {
        return new TimeRange(startMillis * 1000L, endMillis * 1000L);
    }

    public static TimeRange of(Instant start, Instant end) {
        return new TimeRange(toMicros(start), toMicros(end));
    }

    private static long toMicros(Instant instant) {
        return ChronoUnit.MICROS.between(Instant.EPOCH, instant);
    }
}
