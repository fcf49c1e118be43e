package com.quarry.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Column-oriented result handed back to the caller.
 * Rows are added by projecting a map through the declared fields; missing keys become null.
 */
@Getter
@ToString
public class ResultFrame {

    private final String refId;
    private final FrameType preferredVisualisation;
    private final List<FrameField> fields = new ArrayList<>();
    private int length;

    public ResultFrame(String refId, FrameType preferredVisualisation) {
        this.refId = refId;
        this.preferredVisualisation = preferredVisualisation;
    }

    public ResultFrame addField(FrameField field) {
        if (length > 0) {
            throw new IllegalStateException("Fields must be declared before rows are added");
        }
        fields.add(field);
        return this;
    }

    public void addRow(Map<String, ?> row) {
        for (FrameField field : fields) {
            field.append(row.get(field.getName()));
        }
        length++;
    }

    public List<FrameField> getFields() {
        return Collections.unmodifiableList(fields);
    }

    @JsonIgnore
    public List<String> getFieldNames() {
        return fields.stream().map(FrameField::getName).toList();
    }

    public Optional<FrameField> field(String name) {
        return fields.stream().filter(f -> f.getName().equals(name)).findFirst();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return length == 0;
    }
}
