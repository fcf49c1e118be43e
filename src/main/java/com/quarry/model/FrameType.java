package com.quarry.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Preferred visualisation of a frame.
 */
public enum FrameType {
    LOGS("logs"),
    GRAPH("graph");

    private final String value;

    FrameType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
