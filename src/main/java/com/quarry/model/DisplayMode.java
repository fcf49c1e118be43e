package com.quarry.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the caller intends to render a target's result.
 */
public enum DisplayMode {
    LOGS("logs"),
    GRAPH("graph"),
    AUTO("auto");

    private final String value;

    DisplayMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lenient parse; unknown or missing values fall back to AUTO.
     */
    @JsonCreator
    public static DisplayMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        for (DisplayMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        return AUTO;
    }
}
