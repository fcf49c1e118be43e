package com.quarry.service.frame;

import com.fasterxml.jackson.databind.JsonNode;
import com.quarry.TestFixtures;
import com.quarry.model.FieldType;
import com.quarry.model.FrameField;
import com.quarry.model.FrameType;
import com.quarry.model.QueryTarget;
import com.quarry.model.ResultFrame;
import com.quarry.model.StreamField;
import com.quarry.model.StreamFieldSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.quarry.backend.FakeSearchBackend.row;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ResponseShaper.
 */
class ResponseShaperTest {

    private ResponseShaper shaper;
    private QueryTarget target;
    private StreamFieldSet fields;

    @BeforeEach
    void setUp() {
        shaper = TestFixtures.shaper();
        target = QueryTarget.builder().refId("A").stream("default").organization("org").build();
        fields = StreamFieldSet.of(List.of(
                new StreamField("level", "Utf8"),
                new StreamField("code", "Int64")));
    }

    @Test
    void testLogsFrameHasFixedHeadThenStreamFields() throws Exception {
        List<Map<String, Object>> hits = List.of(
                row("_timestamp", 1_700_000_000_000_000L, "level", "info", "code", 200, "extra", "x"));

        ResultFrame frame = shaper.toLogsFrame(hits, target, fields, "_timestamp");

        assertEquals(FrameType.LOGS, frame.getPreferredVisualisation());
        assertEquals("A", frame.getRefId());
        assertEquals(List.of("Time", "Content", "level", "code"), frame.getFieldNames());
        assertEquals(1, frame.getLength());
        assertEquals(FieldType.TIME, frame.getFields().get(0).getType());
        assertEquals(FieldType.NUMBER, frame.field("code").orElseThrow().getType());

        assertEquals(1_700_000_000_000L, frame.field("Time").orElseThrow().getValues().get(0));
        assertEquals("info", frame.field("level").orElseThrow().getValues().get(0));

        String content = (String) frame.field("Content").orElseThrow().getValues().get(0);
        JsonNode parsed = TestFixtures.MAPPER.readTree(content);
        assertEquals("x", parsed.get("extra").asText());
        assertFalse(frame.field("extra").isPresent());
    }

    @Test
    void testLogsFrameSchemaIsStableWhenEmpty() {
        ResultFrame frame = shaper.toLogsFrame(List.of(), target, fields, "_timestamp");

        assertEquals(List.of("Time", "Content", "level", "code"), frame.getFieldNames());
        assertTrue(frame.isEmpty());
    }

    @Test
    void testLogsFrameToleratesMissingTimestamp() {
        ResultFrame frame = shaper.toLogsFrame(List.of(row("level", "warn")), target, fields, "_timestamp");

        assertNull(frame.field("Time").orElseThrow().getValues().get(0));
        assertNull(frame.field("code").orElseThrow().getValues().get(0));
    }

    @Test
    void testGraphFrameDetectsTimestampColumn() {
        List<Map<String, Object>> hits = List.of(
                row("zo_sql_key", "2024-01-01T00:00:00", "zo_sql_num", 5, "ok", true),
                row("zo_sql_key", "2024-01-01T00:01:00", "zo_sql_num", 7, "ok", false));

        ResultFrame frame = shaper.toGraphFrame(hits, target, "_timestamp");

        assertEquals(FrameType.GRAPH, frame.getPreferredVisualisation());
        assertEquals(List.of("Time", "zo_sql_num", "ok"), frame.getFieldNames());

        FrameField time = frame.getFields().get(0);
        assertEquals(FieldType.TIME, time.getType());
        assertEquals(true, time.getConfig().get("filterable"));
        assertEquals(List.of(1_704_067_200_000L, 1_704_067_260_000L), time.getValues());

        assertEquals(FieldType.NUMBER, frame.field("zo_sql_num").orElseThrow().getType());
        assertEquals(FieldType.BOOLEAN, frame.field("ok").orElseThrow().getType());
        assertEquals(List.of(5, 7), frame.field("zo_sql_num").orElseThrow().getValues());
    }

    @Test
    void testGraphFrameFallsBackToGivenTimestampColumn() {
        List<Map<String, Object>> hits = List.of(row("bucket", 5, "service", "api"));

        ResultFrame frame = shaper.toGraphFrame(hits, target, "bucket");

        assertEquals(List.of("Time", "service"), frame.getFieldNames());
        assertEquals(5_000L, frame.field("Time").orElseThrow().getValues().get(0));
        assertEquals(FieldType.STRING, frame.field("service").orElseThrow().getType());
    }

    @Test
    void testGraphFrameSchemaIsStableWhenEmpty() {
        ResultFrame frame = shaper.toGraphFrame(List.of(), target, "_timestamp");

        assertEquals(List.of("Time", "zo_sql_num", "x_axis_1"), frame.getFieldNames());
        assertTrue(frame.isEmpty());

        ResultFrame fromNull = shaper.toGraphFrame(null, target, "_timestamp");
        assertEquals(frame.getFieldNames(), fromNull.getFieldNames());
    }
}
