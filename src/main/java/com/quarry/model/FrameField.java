package com.quarry.model;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One column of a {@link ResultFrame}.
 */
@Getter
@ToString
public class FrameField {

    private final String name;
    private final FieldType type;
    private final Map<String, Object> config;
    private final List<Object> values = new ArrayList<>();

    public FrameField(String name, FieldType type) {
        this(name, type, Map.of());
    }

    public FrameField(String name, FieldType type, Map<String, Object> config) {
        this.name = name;
        this.type = type;
        this.config = config;
    }

    void append(Object value) {
        values.add(value);
    }

    public List<Object> getValues() {
        return Collections.unmodifiableList(values);
    }
}
