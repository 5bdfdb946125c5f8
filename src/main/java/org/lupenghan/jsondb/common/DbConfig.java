package org.lupenghan.jsondb.common;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Properties;

/**
 * 数据库配置，构造数据库时显式传入
 */
@Slf4j
@Getter
@ToString
@Builder(toBuilder = true)
public class DbConfig {
    public static final String RESOURCE_NAME = "jsondb.properties";

    public static final String KEY_PATH = "jsondb.path";
    public static final String KEY_LOGGING = "jsondb.logging.enabled";
    public static final String KEY_MAX_RECORDS = "jsondb.max-records-per-table";
    public static final String KEY_SAVE_INTERVAL = "jsondb.save-interval-millis";
    public static final String KEY_PRETTY_PRINT = "jsondb.pretty-print";

    // 数据文件路径
    @Builder.Default
    private final Path path = Paths.get("jsondb_data.json");
    // 是否输出日志
    @Builder.Default
    private final boolean enableLogging = true;
    // 单表最大记录数
    @Builder.Default
    private final int maxRecordsPerTable = 100000;
    // 两次非强制保存的最小间隔
    @Builder.Default
    private final long saveIntervalMillis = 1000L;
    @Builder.Default
    private final boolean prettyPrint = true;
    // 时间戳和保存节流使用的时钟
    @Builder.Default
    @ToString.Exclude
    private final Clock clock = Clock.systemDefaultZone();

    public static DbConfig defaults() {
        return DbConfig.builder().build();
    }

    /**
     * 读取 classpath 下的 jsondb.properties，再用同名的 JVM 系统属性覆盖
     */
    public static DbConfig load() {
        Properties props = new Properties();
        try (InputStream in = DbConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new DbException(ErrorKind.IO, "读取配置文件失败: " + RESOURCE_NAME, e);
        }
        for (String key : new String[]{KEY_PATH, KEY_LOGGING, KEY_MAX_RECORDS, KEY_SAVE_INTERVAL, KEY_PRETTY_PRINT}) {
            String override = System.getProperty(key);
            if (override != null) {
                props.setProperty(key, override);
            }
        }
        return fromProperties(props);
    }

    public static DbConfig fromProperties(Properties props) {
        DbConfigBuilder builder = DbConfig.builder();
        String path = props.getProperty(KEY_PATH);
        if (path != null && !path.isBlank()) {
            builder.path(Paths.get(path.trim()));
        }
        String logging = props.getProperty(KEY_LOGGING);
        if (logging != null) {
            builder.enableLogging(Boolean.parseBoolean(logging.trim()));
        }
        String maxRecords = props.getProperty(KEY_MAX_RECORDS);
        if (maxRecords != null) {
            builder.maxRecordsPerTable(parseNonNegativeInt(KEY_MAX_RECORDS, maxRecords));
        }
        String interval = props.getProperty(KEY_SAVE_INTERVAL);
        if (interval != null) {
            builder.saveIntervalMillis(parseNonNegative(KEY_SAVE_INTERVAL, interval));
        }
        String pretty = props.getProperty(KEY_PRETTY_PRINT);
        if (pretty != null) {
            builder.prettyPrint(Boolean.parseBoolean(pretty.trim()));
        }
        DbConfig config = builder.build();
        log.debug("加载配置: {}", config);
        return config;
    }

    private static long parseNonNegative(String key, String raw) {
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new DbException(ErrorKind.VALIDATION, "配置项 " + key + " 不是合法整数: " + raw, e);
        }
        if (value < 0) {
            throw new DbException(ErrorKind.VALIDATION, "配置项 " + key + " 不能为负数: " + raw);
        }
        return value;
    }

    private static int parseNonNegativeInt(String key, String raw) {
        long value = parseNonNegative(key, raw);
        if (value > Integer.MAX_VALUE) {
            throw new DbException(ErrorKind.VALIDATION, "配置项 " + key + " 超出范围: " + raw);
        }
        return (int) value;
    }
}
