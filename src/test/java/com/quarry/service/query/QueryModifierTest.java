package com.quarry.service.query;

import com.quarry.model.QueryTarget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for QueryModifier.
 */
class QueryModifierTest {

    private QueryModifier modifier;

    @BeforeEach
    void setUp() {
        modifier = new QueryModifier();
    }

    @Test
    void testAddFilterToEmptyQuery() {
        QueryTarget target = QueryTarget.builder().refId("A").build();

        QueryTarget modified = modifier.modify(target, QueryModifier.Action.ADD_FILTER, "level", "error");

        assertEquals("level='error'", modified.getQuery());
        assertEquals("A", modified.getRefId());
        assertNull(target.getQuery());
    }

    @Test
    void testAddFilterOutAppendsWithAnd() {
        QueryTarget target = QueryTarget.builder().refId("A").query("status=200").build();

        QueryTarget modified = modifier.modify(target, QueryModifier.Action.ADD_FILTER_OUT, "level", "debug");

        assertEquals("status=200 and level!='debug'", modified.getQuery());
    }

    @Test
    void testMissingKeyLeavesTargetUnchanged() {
        QueryTarget target = QueryTarget.builder().refId("A").query("status=200").build();

        assertSame(target, modifier.modify(target, QueryModifier.Action.ADD_FILTER, null, "x"));
    }
}
