package com.quarry.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Column value types understood by the front-end.
 */
public enum FieldType {
    TIME("time"),
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean");

    private final String value;

    FieldType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Maps a backend (Arrow) type name such as {@code Int64} or {@code Utf8}.
     */
    public static FieldType fromStreamType(String streamType) {
        if (streamType == null) {
            return STRING;
        }
        String normalized = streamType.trim().toLowerCase();
        if (normalized.startsWith("int") || normalized.startsWith("uint")
                || normalized.startsWith("float") || normalized.startsWith("decimal")) {
            return NUMBER;
        }
        if (normalized.equals("boolean") || normalized.equals("bool")) {
            return BOOLEAN;
        }
        return STRING;
    }

    /**
     * Infers a type from a sample value.
     */
    public static FieldType inferFrom(Object value) {
        if (value instanceof Number) {
            return NUMBER;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        return STRING;
    }
}
