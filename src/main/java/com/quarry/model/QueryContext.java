package com.quarry.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The front-end screen a batch was issued from.
 * Only EXPLORE asks the backend for sample rows; every other context sends size 0.
 */
public enum QueryContext {
    EXPLORE("explore"),
    DASHBOARD("dashboard"),
    PANEL_EDITOR("panel-editor"),
    UNKNOWN("unknown");

    private final String value;

    QueryContext(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static QueryContext fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (QueryContext context : values()) {
            if (context.value.equalsIgnoreCase(value.trim())) {
                return context;
            }
        }
        return UNKNOWN;
    }
}
