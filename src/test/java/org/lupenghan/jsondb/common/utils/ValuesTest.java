package org.lupenghan.jsondb.common.utils;

import org.junit.Test;
import org.lupenghan.jsondb.common.DbException;
import org.lupenghan.jsondb.common.ErrorKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ValuesTest {

    @Test
    public void testNumbersOfDifferentTypesAreEqual() {
        assertTrue(Values.valuesEqual(30, 30L));
        assertTrue(Values.valuesEqual(30, 30.0));
        assertTrue(Values.valuesEqual(null, null));
        assertFalse(Values.valuesEqual("30", 30));
        assertFalse(Values.valuesEqual(30, null));
    }

    @Test
    public void testCompare() {
        assertTrue(Values.compare(1, 2.5) < 0);
        assertTrue(Values.compare("b", "a") > 0);
        assertEquals(Integer.valueOf(0), Values.compare(40L, 40));
        assertNull(Values.compare("a", 1));
        assertNull(Values.compare(null, 1));
    }

    @Test
    public void testDeepCopyIsIndependent() {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("tags", new ArrayList<>(Arrays.asList("a", "b")));
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("meta", nested);

        Map<String, Object> copy = Values.copyRecord(record);
        ((List<Object>) ((Map<String, Object>) copy.get("meta")).get("tags")).add("c");

        assertEquals(2, ((List<?>) nested.get("tags")).size());
    }

    @Test
    public void testDeepCopyRejectsUnsupportedValues() {
        try {
            Values.deepCopy(new Object());
            fail("expected validation error");
        } catch (DbException e) {
            assertEquals(ErrorKind.VALIDATION, e.getKind());
        }
    }

    @Test
    public void testTextAndStringKey() {
        assertEquals("30", Values.text(30L));
        assertEquals("2.5", Values.text(2.5));
        assertEquals("30", Values.stringKey(30.0));
        assertEquals("null", Values.stringKey(null));
        assertEquals("eng", Values.stringKey("eng"));
    }
}
