package com.quarry.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One logical query submitted for resolution.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueryTarget {

    /**
     * Stable identifier; {@code log-volume-} prefixed ids mark derived volume targets.
     */
    @JsonProperty("refId")
    private String refId;

    /**
     * Filter expression, or native SQL when {@link #sqlMode} is set.
     */
    private String query;

    @JsonProperty("sqlMode")
    private boolean sqlMode;

    @JsonProperty("displayMode")
    @Builder.Default
    private DisplayMode displayMode = DisplayMode.AUTO;

    private String organization;

    private String stream;

    public DisplayMode getDisplayMode() {
        return displayMode != null ? displayMode : DisplayMode.AUTO;
    }
}
