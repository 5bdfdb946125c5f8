package org.lupenghan.jsondb.cli;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.lupenghan.jsondb.common.DbConfig;
import org.lupenghan.jsondb.common.DbException;
import org.lupenghan.jsondb.common.ErrorKind;
import org.lupenghan.jsondb.engine.interfaces.Database;
import org.lupenghan.jsondb.engine.models.DatabaseInfo;
import org.lupenghan.jsondb.schema.models.FieldType;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CommandExecutorTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Database db;
    private CommandExecutor executor;

    @Before
    public void setUp() {
        db = Database.open(DbConfig.builder().path(folder.getRoot().toPath().resolve("cli.json")).build());
        executor = new CommandExecutor(db);
    }

    @After
    public void tearDown() {
        db.close();
    }

    private Object run(String line) {
        return executor.execute(CommandParser.parse(line));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testCreateInsertSelect() {
        assertEquals(true, run("create users {\"name\": {\"type\": \"str\", \"required\": true, \"max_length\": 5}}"));
        assertEquals(FieldType.STRING, db.getSchema("users").get("name").getType());
        assertEquals(Integer.valueOf(5), db.getSchema("users").get("name").getMaxLength());

        run("insert users {\"name\": \"Ann\", \"age\": 20}");
        run("insert users {\"name\": \"Ben\", \"age\": 35}");
        List<Map<String, Object>> rows = (List<Map<String, Object>>) run("select users {\"age\": {\"$gt\": 30}}");
        assertEquals(1, rows.size());
        assertEquals("Ben", rows.get(0).get("name"));

        assertEquals(2, run("count users"));
        assertEquals(Collections.singletonList("users"), run("tables"));
    }

    @Test
    public void testUpdateDeleteIndexAggregate() {
        run("create staff");
        run("insert staff {\"dept\": \"eng\"}");
        run("insert staff {\"dept\": \"hr\"}");
        assertEquals(true, run("index staff dept"));
        assertEquals(1, run("update staff {\"dept\": \"hr\"} {\"dept\": \"eng\"}"));
        List<?> groups = (List<?>) run("aggregate staff [{\"$group\": {\"_id\": \"dept\"}}]");
        assertEquals(1, groups.size());
        assertEquals(2, run("delete staff {\"dept\": \"eng\"}"));
    }

    @Test
    public void testSqlCommand() {
        run("create users");
        run("insert users {\"name\": \"Ann\"}");
        assertEquals(1, run("sql SELECT COUNT(*) FROM users"));
        assertEquals(Collections.singletonList("users"), run("sql SHOW TABLES"));
        assertKind(ErrorKind.ENGINE, "sql DROP TABLE users");
    }

    @Test
    public void testInfo() {
        run("create users");
        assertTrue(run("info") instanceof DatabaseInfo);
    }

    @Test
    public void testErrorsSurfaceAsDbException() {
        assertKind(ErrorKind.TABLE_NOT_FOUND, "insert missing {\"a\": 1}");
        assertKind(ErrorKind.VALIDATION, "insert users");
        assertKind(ErrorKind.VALIDATION, "restore");
        assertKind(ErrorKind.VALIDATION, "frobnicate");
    }

    private void assertKind(ErrorKind expected, String line) {
        try {
            run(line);
            fail("expected " + expected);
        } catch (DbException e) {
            assertEquals(expected, e.getKind());
        }
    }
}
