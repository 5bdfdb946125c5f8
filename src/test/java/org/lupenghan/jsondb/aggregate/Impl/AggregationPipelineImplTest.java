package org.lupenghan.jsondb.aggregate.Impl;

import org.junit.Before;
import org.junit.Test;
import org.lupenghan.jsondb.aggregate.models.GroupStage;
import org.lupenghan.jsondb.aggregate.models.MatchStage;
import org.lupenghan.jsondb.aggregate.models.Stage;
import org.lupenghan.jsondb.common.DbException;
import org.lupenghan.jsondb.common.ErrorKind;
import org.lupenghan.jsondb.storage.models.DatabaseState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class AggregationPipelineImplTest {
    private DatabaseState state;
    private AggregationPipelineImpl pipeline;

    @Before
    public void setUp() {
        state = new DatabaseState();
        List<Map<String, Object>> staff = new ArrayList<>();
        staff.add(member("eng", 20));
        staff.add(member("eng", 40));
        staff.add(member("hr", 30));
        state.getTables().put("staff", staff);
        pipeline = new AggregationPipelineImpl(state);
    }

    @Test
    public void testMatchThenGroup() {
        List<Map<String, Object>> result = pipeline.aggregate("staff", Arrays.asList(
                Map.of("$match", Map.of("dept", "eng")),
                Map.of("$group", Map.of("_id", "dept"))));
        assertEquals(1, result.size());
        assertEquals("eng", result.get(0).get("_id"));
        assertEquals(2, result.get(0).get("count"));

        state.records("staff").remove(0);
        result = pipeline.aggregate("staff", Arrays.asList(
                Map.of("$match", Map.of("dept", "eng")),
                Map.of("$group", Map.of("_id", "dept"))));
        assertEquals(1, result.get(0).get("count"));
    }

    @Test
    public void testGroupKeepsFirstSeenOrder() {
        List<Map<String, Object>> result = pipeline.aggregate("staff",
                List.of(Map.of("$group", Map.of("_id", "dept"))));
        assertEquals(2, result.size());
        assertEquals("eng", result.get(0).get("_id"));
        assertEquals("hr", result.get(1).get("_id"));
        assertEquals(1, result.get(1).get("count"));
    }

    @Test
    public void testMissingGroupFieldFormsNullGroup() {
        List<Map<String, Object>> result = pipeline.aggregate("staff",
                List.of(Map.of("$group", Map.of("_id", "level"))));
        assertEquals(1, result.size());
        assertNull(result.get(0).get("_id"));
        assertEquals(3, result.get(0).get("count"));
    }

    @Test
    public void testEmptyPipelineReturnsAllRecords() {
        assertEquals(3, pipeline.aggregate("staff", new ArrayList<>()).size());
    }

    @Test
    public void testMissingTableReturnsEmpty() {
        assertTrue(pipeline.aggregate("nope", List.of(Map.of("$group", Map.of("_id", "dept")))).isEmpty());
    }

    @Test
    public void testGroupTakesPrecedenceInOneStage() {
        Map<String, Object> both = new LinkedHashMap<>();
        both.put("$match", Map.of("dept", "eng"));
        both.put("$group", Map.of("_id", "dept"));
        List<Stage> stages = pipeline.parse(List.of(both));
        assertEquals(1, stages.size());
        assertTrue(stages.get(0) instanceof GroupStage);
    }

    @Test
    public void testUnknownStageIgnored() {
        List<Stage> stages = pipeline.parse(List.of(
                Map.of("$sort", Map.of("age", 1)),
                Map.of("$match", Map.of("dept", "hr"))));
        assertEquals(1, stages.size());
        assertTrue(stages.get(0) instanceof MatchStage);
    }

    @Test
    public void testGroupWithoutFieldRejected() {
        try {
            pipeline.parse(List.of(Map.of("$group", Map.of("by", "dept"))));
            fail("expected validation error");
        } catch (DbException e) {
            assertEquals(ErrorKind.VALIDATION, e.getKind());
        }
    }

    private static Map<String, Object> member(String dept, int age) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("dept", dept);
        record.put("age", age);
        return record;
    }
}
