package org.lupenghan.jsondb.common;

import org.junit.After;
import org.junit.Test;

import java.nio.file.Paths;
import java.util.Properties;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class DbConfigTest {

    @After
    public void tearDown() {
        System.clearProperty(DbConfig.KEY_PATH);
        System.clearProperty(DbConfig.KEY_MAX_RECORDS);
    }

    @Test
    public void testDefaults() {
        DbConfig config = DbConfig.defaults();
        assertEquals(Paths.get("jsondb_data.json"), config.getPath());
        assertTrue(config.isEnableLogging());
        assertEquals(100000, config.getMaxRecordsPerTable());
        assertEquals(1000L, config.getSaveIntervalMillis());
    }

    @Test
    public void testFromProperties() {
        Properties props = new Properties();
        props.setProperty(DbConfig.KEY_PATH, "data/test.json");
        props.setProperty(DbConfig.KEY_LOGGING, "false");
        props.setProperty(DbConfig.KEY_MAX_RECORDS, "10");
        props.setProperty(DbConfig.KEY_SAVE_INTERVAL, "0");

        DbConfig config = DbConfig.fromProperties(props);

        assertEquals(Paths.get("data/test.json"), config.getPath());
        assertFalse(config.isEnableLogging());
        assertEquals(10, config.getMaxRecordsPerTable());
        assertEquals(0L, config.getSaveIntervalMillis());
    }

    @Test
    public void testInvalidNumberIsRejected() {
        Properties props = new Properties();
        props.setProperty(DbConfig.KEY_MAX_RECORDS, "many");
        try {
            DbConfig.fromProperties(props);
            fail("expected validation error");
        } catch (DbException e) {
            assertEquals(ErrorKind.VALIDATION, e.getKind());
        }
    }

    @Test
    public void testSaveIntervalAcceptsLongValues() {
        Properties props = new Properties();
        props.setProperty(DbConfig.KEY_SAVE_INTERVAL, "86400000000");
        assertEquals(86_400_000_000L, DbConfig.fromProperties(props).getSaveIntervalMillis());
    }

    @Test
    public void testNegativeAndOversizedValuesAreRejected() {
        assertRejected(DbConfig.KEY_SAVE_INTERVAL, "-1");
        assertRejected(DbConfig.KEY_MAX_RECORDS, "-5");
        assertRejected(DbConfig.KEY_MAX_RECORDS, "3000000000");
    }

    private static void assertRejected(String key, String value) {
        Properties props = new Properties();
        props.setProperty(key, value);
        try {
            DbConfig.fromProperties(props);
            fail("expected validation error for " + key + "=" + value);
        } catch (DbException e) {
            assertEquals(ErrorKind.VALIDATION, e.getKind());
        }
    }

    @Test
    public void testSystemPropertiesOverrideResource() {
        System.setProperty(DbConfig.KEY_PATH, "override.json");
        System.setProperty(DbConfig.KEY_MAX_RECORDS, "5");

        DbConfig config = DbConfig.load();

        assertEquals(Paths.get("override.json"), config.getPath());
        assertEquals(5, config.getMaxRecordsPerTable());
    }
}
