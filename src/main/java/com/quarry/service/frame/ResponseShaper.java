package com.quarry.service.frame;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quarry.model.FieldType;
import com.quarry.model.FrameField;
import com.quarry.model.FrameType;
import com.quarry.model.QueryTarget;
import com.quarry.model.ResultFrame;
import com.quarry.model.StreamField;
import com.quarry.model.StreamFieldSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shapes raw backend hits into logs or graph frames.
 *
 * Both shapes are stable for an empty hit list so the front-end can render an empty state.
 */
@Slf4j
@Component
public class ResponseShaper {

    public static final String TIME_FIELD = "Time";
    public static final String CONTENT_FIELD = "Content";

    /**
     * Graph columns used when there is no data to derive them from; the first is the time column.
     */
    static final List<String> DEFAULT_GRAPH_FIELDS = List.of("zo_sql_key", "zo_sql_num", "x_axis_1");

    private final ObjectMapper objectMapper;

    public ResponseShaper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Logs frame: Time, Content, then one column per stream field in order.
     * Keys outside the field set only survive inside Content.
     */
    public ResultFrame toLogsFrame(List<Map<String, Object>> hits, QueryTarget target,
                                   StreamFieldSet streamFields, String timestampColumn) {
        ResultFrame frame = new ResultFrame(target.getRefId(), FrameType.LOGS);
        frame.addField(new FrameField(TIME_FIELD, FieldType.TIME));
        frame.addField(new FrameField(CONTENT_FIELD, FieldType.STRING));
        for (StreamField field : streamFields) {
            frame.addField(new FrameField(field.getName(), FieldType.fromStreamType(field.getType())));
        }

        for (Map<String, Object> hit : safe(hits)) {
            Map<String, Object> row = new HashMap<>(hit);
            row.put(CONTENT_FIELD, serialize(hit));
            row.put(TIME_FIELD, TimeNormalizer.toMillis(hit.get(timestampColumn)));
            frame.addRow(row);
        }
        return frame;
    }

    /**
     * Graph frame: columns come from the first hit, with the detected timestamp column renamed to Time.
     *
     * @param timestampColumn used when no value in the first hit looks like a timestamp
     */
    public ResultFrame toGraphFrame(List<Map<String, Object>> hits, QueryTarget target, String timestampColumn) {
        List<Map<String, Object>> rows = safe(hits);
        ResultFrame frame = new ResultFrame(target.getRefId(), FrameType.GRAPH);

        if (rows.isEmpty()) {
            frame.addField(timeField());
            DEFAULT_GRAPH_FIELDS.stream().skip(1)
                    .forEach(name -> frame.addField(new FrameField(name, FieldType.NUMBER)));
            return frame;
        }

        Map<String, Object> first = rows.get(0);
        List<String> columns = new ArrayList<>(first.keySet());
        String timeColumn = detectTimestampField(first);
        if (timeColumn == null) {
            timeColumn = timestampColumn;
        }

        for (String column : columns) {
            if (column.equals(timeColumn)) {
                frame.addField(timeField());
            } else {
                frame.addField(new FrameField(column, FieldType.inferFrom(first.get(column))));
            }
        }

        for (Map<String, Object> hit : rows) {
            frame.addRow(project(hit, columns, timeColumn));
        }
        return frame;
    }

    /**
     * First key of the row whose value looks like a timestamp, or null.
     */
    static String detectTimestampField(Map<String, Object> row) {
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            if (TimeNormalizer.isTimeLike(entry.getValue())) {
                return entry.getKey();
            }
        }
        return null;
    }

    private static Map<String, Object> project(Map<String, Object> hit, List<String> columns, String timeColumn) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (String column : columns) {
            if (column.equals(timeColumn)) {
                row.put(TIME_FIELD, TimeNormalizer.toMillis(hit.get(column)));
            } else {
                row.put(column, hit.get(column));
            }
        }
        return row;
    }

    private static FrameField timeField() {
        return new FrameField(TIME_FIELD, FieldType.TIME, Map.of("filterable", true));
    }

    private String serialize(Map<String, Object> hit) {
        try {
            return objectMapper.writeValueAsString(hit);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize hit, falling back to toString: {}", e.getMessage());
            return String.valueOf(hit);
        }
    }

    private static List<Map<String, Object>> safe(List<Map<String, Object>> hits) {
        if (hits == null) {
            return List.of();
        }
        List<Map<String, Object>> rows = new ArrayList<>(hits.size());
        for (Map<String, Object> hit : hits) {
            if (hit != null) {
                rows.add(hit);
            }
        }
        return rows;
    }
}
