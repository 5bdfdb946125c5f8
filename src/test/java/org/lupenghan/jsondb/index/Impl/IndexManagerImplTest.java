package org.lupenghan.jsondb.index.Impl;

import org.junit.Before;
import org.junit.Test;
import org.lupenghan.jsondb.common.DbException;
import org.lupenghan.jsondb.common.ErrorKind;
import org.lupenghan.jsondb.storage.models.DatabaseState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class IndexManagerImplTest {
    private DatabaseState state;
    private IndexManagerImpl indexManager;

    @Before
    public void setUp() {
        state = new DatabaseState();
        List<Map<String, Object>> staff = new ArrayList<>();
        staff.add(record("eng", 20));
        staff.add(record("eng", 40));
        staff.add(record("hr", 30));
        state.getTables().put("staff", staff);
        indexManager = new IndexManagerImpl(state);
    }

    @Test
    public void testCreateIndexScansExistingRecords() {
        assertTrue(indexManager.createIndex("staff", "dept"));
        assertEquals(Arrays.asList(0, 1), indexManager.lookup("staff", "dept", "eng"));
        assertEquals(Collections.singletonList(2), indexManager.lookup("staff", "dept", "hr"));
        assertTrue(indexManager.lookup("staff", "dept", "ops").isEmpty());
    }

    @Test
    public void testCreateIndexTwiceReturnsFalse() {
        assertTrue(indexManager.createIndex("staff", "dept"));
        assertFalse(indexManager.createIndex("staff", "dept"));
    }

    @Test
    public void testCreateIndexOnMissingTable() {
        try {
            indexManager.createIndex("nope", "dept");
            fail("expected table not found");
        } catch (DbException e) {
            assertEquals(ErrorKind.TABLE_NOT_FOUND, e.getKind());
        }
    }

    @Test
    public void testDropIndex() {
        indexManager.createIndex("staff", "dept");
        assertTrue(indexManager.dropIndex("staff", "dept"));
        assertFalse(indexManager.dropIndex("staff", "dept"));
        assertFalse(indexManager.hasIndex("staff", "dept"));
    }

    @Test
    public void testOnInsertAppendsPosition() {
        indexManager.createIndex("staff", "dept");
        Map<String, Object> added = record("hr", 50);
        state.records("staff").add(added);
        indexManager.onInsert("staff", added, 3);

        assertEquals(Arrays.asList(2, 3), indexManager.lookup("staff", "dept", "hr"));
    }

    @Test
    public void testRebuildAfterRemovalShiftsPositions() {
        indexManager.createIndex("staff", "dept");
        state.records("staff").remove(0);
        indexManager.rebuildAll("staff");

        assertEquals(Collections.singletonList(0), indexManager.lookup("staff", "dept", "eng"));
        assertEquals(Collections.singletonList(1), indexManager.lookup("staff", "dept", "hr"));
    }

    @Test
    public void testNumericKeysAreNormalized() {
        indexManager.createIndex("staff", "age");
        assertEquals(Collections.singletonList(1), indexManager.lookup("staff", "age", 40L));
        assertEquals(Collections.singletonList(1), indexManager.lookup("staff", "age", 40.0));
    }

    @Test
    public void testPersistedFormUsesStringKeys() {
        indexManager.createIndex("staff", "age");
        Map<String, List<Integer>> persisted = indexManager.toPersistedForm().get("staff").get("age");
        assertEquals(Collections.singletonList(0), persisted.get("20"));
        assertEquals(Collections.singletonList(2), persisted.get("30"));
    }

    @Test
    public void testClearKeepsDefinition() {
        indexManager.createIndex("staff", "dept");
        indexManager.clear("staff");
        assertTrue(indexManager.hasIndex("staff", "dept"));
        assertTrue(indexManager.lookup("staff", "dept", "eng").isEmpty());
    }

    private static Map<String, Object> record(String dept, int age) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("dept", dept);
        record.put("age", age);
        return record;
    }
}
