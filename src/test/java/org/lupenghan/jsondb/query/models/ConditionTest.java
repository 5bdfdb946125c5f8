package org.lupenghan.jsondb.query.models;

import org.junit.Test;
import org.lupenghan.jsondb.common.DbException;
import org.lupenghan.jsondb.common.ErrorKind;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ConditionTest {

    @Test
    public void testLiteralBecomesEquality() {
        Condition condition = Condition.parse(Map.of("dept", "eng"));
        assertEquals(1, condition.getPredicates().size());
        assertTrue(condition.getPredicates().get(0) instanceof EqualsCondition);
        assertTrue(condition.singleEquality().isPresent());
    }

    @Test
    public void testOperatorsOnOneFieldAreSplitIntoRangeAndLike() {
        Map<String, Object> ops = new LinkedHashMap<>();
        ops.put("$gte", 1);
        ops.put("$like", "A");
        Condition condition = Condition.parse(Map.of("name", ops));

        assertEquals(2, condition.getPredicates().size());
        assertFalse(condition.singleEquality().isPresent());
    }

    @Test
    public void testRangeBoundsAreAnded() {
        Condition condition = Condition.parse(Map.of("age", Map.of("$gt", 18, "$lte", 60)));
        assertTrue(condition.test(record("age", 60)));
        assertFalse(condition.test(record("age", 18)));
        assertFalse(condition.test(record("age", 61)));
    }

    @Test
    public void testMissingFieldFailsEveryKindOfCondition() {
        Map<String, Object> empty = record("other", 1);
        assertFalse(Condition.parse(Map.of("age", Map.of("$gt", 1))).test(empty));
        assertFalse(Condition.parse(Map.of("name", Map.of("$like", "a"))).test(empty));
        Map<String, Object> nullLiteral = new LinkedHashMap<>();
        nullLiteral.put("age", null);
        assertFalse(Condition.parse(nullLiteral).test(empty));
    }

    @Test
    public void testLikeIsCaseInsensitiveSubstring() {
        Condition condition = Condition.parse(Map.of("name", Map.of("$like", "ALI")));
        assertTrue(condition.test(record("name", "Natalie")));
        assertFalse(condition.test(record("name", "Bob")));
    }

    @Test
    public void testIncomparableValuesDoNotMatch() {
        Condition condition = Condition.parse(Map.of("age", Map.of("$gt", 10)));
        assertFalse(condition.test(record("age", "eleven")));
    }

    @Test
    public void testMapWithoutOperatorsIsNestedEquality() {
        Condition condition = Condition.parse(Map.of("meta", Map.of("level", 2)));
        assertTrue(condition.test(record("meta", Map.of("level", 2L))));
        assertFalse(condition.test(record("meta", Map.of("level", 3))));
    }

    @Test
    public void testUnknownOperatorIsRejected() {
        try {
            Condition.parse(Map.of("age", Map.of("$ne", 1)));
            fail("expected validation error");
        } catch (DbException e) {
            assertEquals(ErrorKind.VALIDATION, e.getKind());
        }
    }

    @Test
    public void testEmptyConditionMatchesEverything() {
        assertTrue(Condition.parse(null).isEmpty());
        assertTrue(Condition.parse(new LinkedHashMap<>()).test(record("a", 1)));
    }

    private static Map<String, Object> record(String field, Object value) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put(field, value);
        return record;
    }
}
