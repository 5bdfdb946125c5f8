package org.lupenghan.jsondb.transaction.Impl;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.lupenghan.jsondb.common.DbConfig;
import org.lupenghan.jsondb.common.DbException;
import org.lupenghan.jsondb.common.ErrorKind;
import org.lupenghan.jsondb.index.Impl.IndexManagerImpl;
import org.lupenghan.jsondb.schema.models.FieldConstraint;
import org.lupenghan.jsondb.schema.models.FieldType;
import org.lupenghan.jsondb.storage.Impl.JsonFilePersistenceManager;
import org.lupenghan.jsondb.storage.models.DatabaseState;
import org.lupenghan.jsondb.transaction.models.TransactionState;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TransactionManagerImplTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path dataFile;
    private DatabaseState state;
    private IndexManagerImpl indexManager;
    private TransactionManagerImpl tm;

    @Before
    public void setUp() throws IOException {
        dataFile = folder.getRoot().toPath().resolve("tx.json");
        DbConfig config = DbConfig.builder().path(dataFile).build();
        state = new DatabaseState();
        indexManager = new IndexManagerImpl(state);
        JsonFilePersistenceManager persistence = new JsonFilePersistenceManager(config, state, indexManager);
        tm = new TransactionManagerImpl(state, persistence, Clock.systemUTC());

        state.getTables().put("users", new ArrayList<>());
        state.records("users").add(record("name", "Alice"));
    }

    @Test
    public void testBeginCommit() {
        tm.begin();
        assertTrue(tm.isActive());
        state.records("users").add(record("name", "Bob"));
        assertTrue(tm.commit());

        assertEquals(TransactionState.IDLE, tm.getState());
        assertEquals(2, state.records("users").size());
        assertTrue(Files.exists(dataFile));
    }

    @Test
    public void testNestedBeginRejected() {
        tm.begin();
        try {
            tm.begin();
            fail("expected engine error");
        } catch (DbException e) {
            assertEquals(ErrorKind.ENGINE, e.getKind());
        }
        assertTrue(tm.isActive());
    }

    @Test
    public void testCommitWithoutTransaction() {
        try {
            tm.commit();
            fail("expected engine error");
        } catch (DbException e) {
            assertEquals(ErrorKind.ENGINE, e.getKind());
        }
    }

    @Test
    public void testRollbackRestoresTablesSchemasAndIndexes() {
        tm.begin();
        state.records("users").add(record("name", "Bob"));
        state.getTables().put("orders", new ArrayList<>());
        Map<String, FieldConstraint> schema = new LinkedHashMap<>();
        schema.put("name", FieldConstraint.builder().type(FieldType.STRING).required(true).build());
        state.getSchemas().put("users", schema);
        indexManager.createIndex("users", "name");
        tm.rollback();

        assertEquals(1, state.records("users").size());
        assertFalse(state.hasTable("orders"));
        assertNull(state.schema("users"));
        assertFalse(indexManager.hasIndex("users", "name"));
        assertFalse(Files.exists(dataFile));
    }

    @Test
    public void testExecuteRollsBackOnRuntimeException() {
        try {
            tm.execute(() -> {
                state.records("users").clear();
                throw new IllegalStateException("boom");
            });
            fail("expected exception");
        } catch (IllegalStateException e) {
            assertEquals("boom", e.getMessage());
        }
        assertEquals(1, state.records("users").size());
        assertEquals(TransactionState.IDLE, tm.getState());
    }

    @Test
    public void testExecuteWrapsCheckedException() {
        try {
            tm.execute(() -> {
                state.records("users").clear();
                throw new IOException("disk");
            });
            fail("expected exception");
        } catch (DbException e) {
            assertEquals(ErrorKind.ENGINE, e.getKind());
            assertTrue(e.getCause() instanceof IOException);
        }
        assertEquals(1, state.records("users").size());
    }

    @Test
    public void testExecuteCommits() {
        tm.execute(() -> state.records("users").add(record("name", "Carol")));
        assertEquals(2, state.records("users").size());
        assertFalse(tm.isActive());
        assertTrue(Files.exists(dataFile));
    }

    private static Map<String, Object> record(String field, Object value) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put(field, value);
        return record;
    }
}
