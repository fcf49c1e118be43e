package com.quarry.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered, read-only set of stream fields. Duplicate names keep their first occurrence.
 */
public final class StreamFieldSet implements Iterable<StreamField> {

    private static final StreamFieldSet EMPTY = new StreamFieldSet(List.of());

    private final List<StreamField> fields;
    private final Set<String> names;

    private StreamFieldSet(List<StreamField> fields) {
        List<StreamField> ordered = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (StreamField field : fields) {
            if (field != null && field.getName() != null && seen.add(field.getName())) {
                ordered.add(field);
            }
        }
        this.fields = Collections.unmodifiableList(ordered);
        this.names = Collections.unmodifiableSet(seen);
    }

    @JsonCreator
    public static StreamFieldSet of(List<StreamField> fields) {
        if (fields == null || fields.isEmpty()) {
            return EMPTY;
        }
        return new StreamFieldSet(fields);
    }

    public static StreamFieldSet empty() {
        return EMPTY;
    }

    @JsonValue
    public List<StreamField> getFields() {
        return fields;
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    @Override
    public Iterator<StreamField> iterator() {
        return fields.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StreamFieldSet)) {
            return false;
        }
        return fields.equals(((StreamFieldSet) o).fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "StreamFieldSet" + names;
    }
}
