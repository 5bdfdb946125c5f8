package org.lupenghan.jsondb.storage.Impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import lombok.extern.slf4j.Slf4j;
import org.lupenghan.jsondb.common.DbConfig;
import org.lupenghan.jsondb.common.utils.Values;
import org.lupenghan.jsondb.index.interfaces.IndexManager;
import org.lupenghan.jsondb.schema.models.FieldConstraint;
import org.lupenghan.jsondb.storage.interfaces.PersistenceManager;
import org.lupenghan.jsondb.storage.models.DatabaseFile;
import org.lupenghan.jsondb.storage.models.DatabaseState;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单个 JSON 文件的持久化实现
 */
@Slf4j
public class JsonFilePersistenceManager implements PersistenceManager {
    private static final String TABLES_FIELD = "tables";
    private static final DateTimeFormatter BACKUP_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final TypeReference<Map<String, List<Map<String, Object>>>> TABLES_TYPE = new TypeReference<>() {
    };

    private final Path path;
    private final DatabaseState state;
    private final IndexManager indexManager;
    private final Clock clock;
    private final long saveIntervalMillis;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ObjectWriter writer;

    // -1 表示还没有成功保存过
    private long lastSaveMillis = -1;
    private boolean dirty;
    private String createdAt;

    public JsonFilePersistenceManager(DbConfig config, DatabaseState state, IndexManager indexManager) {
        this.path = config.getPath();
        this.state = state;
        this.indexManager = indexManager;
        this.clock = config.getClock();
        this.saveIntervalMillis = config.getSaveIntervalMillis();
        this.writer = config.isPrettyPrint() ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
    }

    @Override
    public void load() {
        state.clear();
        dirty = false;
        if (!Files.exists(path)) {
            return;
        }
        try {
            JsonNode root = mapper.readTree(path.toFile());
            if (root == null || !root.isObject()) {
                log.error("数据库文件格式错误，应为 JSON 对象: {}", path);
                preserveUnreadable();
                return;
            }
            if (root.has(TABLES_FIELD)) {
                DatabaseFile file = mapper.treeToValue(root, DatabaseFile.class);
                createdAt = file.getCreatedAt();
                populate(file.getTables(), file.getSchemas(), file.getIndexes());
            } else {
                // 旧格式：整个文件就是 表名 -> 记录数组
                Map<String, List<Map<String, Object>>> tables = mapper.convertValue(root, TABLES_TYPE);
                populate(tables, null, null);
            }
            log.info("数据库加载成功: {} 个表", state.getTables().size());
        } catch (IOException | IllegalArgumentException e) {
            log.error("数据库加载失败: {}", path, e);
            state.clear();
            preserveUnreadable();
        }
    }

    // 无法解析的文件在下次保存前复制一份，避免被空库覆盖
    private void preserveUnreadable() {
        Path copy = path.resolveSibling(path.getFileName() + ".corrupt_" + LocalDateTime.now(clock).format(BACKUP_SUFFIX));
        try {
            Files.copy(path, copy, StandardCopyOption.REPLACE_EXISTING);
            log.warn("无法解析的数据库文件已另存为: {}", copy);
        } catch (IOException e) {
            log.error("无法保留原数据库文件: {}", path, e);
        }
    }

    private void populate(Map<String, List<Map<String, Object>>> tables,
                          Map<String, Map<String, FieldConstraint>> schemas,
                          Map<String, Map<String, Map<String, List<Integer>>>> indexes) {
        if (tables != null) {
            tables.forEach((name, records) -> state.getTables().put(name,
                    records == null ? new ArrayList<>() : Values.copyRecords(records)));
        }
        if (schemas != null) {
            schemas.forEach((name, schema) -> {
                if (state.hasTable(name) && schema != null) {
                    state.getSchemas().put(name, new LinkedHashMap<>(schema));
                }
            });
        }
        // 文件中的位置映射只作参考，按列名根据当前数据重建
        for (String name : state.getTables().keySet()) {
            Map<String, Map<String, List<Integer>>> columns = indexes == null ? null : indexes.get(name);
            Collection<String> names = columns == null ? Collections.emptyList() : columns.keySet();
            indexManager.restore(name, names);
        }
    }

    @Override
    public boolean save(boolean force) {
        long now = clock.millis();
        if (!force && lastSaveMillis >= 0 && now - lastSaveMillis < saveIntervalMillis) {
            dirty = true;
            log.debug("距上次保存不足 {} 毫秒，跳过本次写入", saveIntervalMillis);
            return true;
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (createdAt == null) {
                createdAt = LocalDateTime.now(clock).toString();
            }
            DatabaseFile file = DatabaseFile.builder()
                    .version(DatabaseFile.CURRENT_VERSION)
                    .createdAt(createdAt)
                    .tables(state.getTables())
                    .schemas(state.getSchemas())
                    .indexes(indexManager.toPersistedForm())
                    .build();
            writer.writeValue(temp.toFile(), file);
            replace(temp, path);
            lastSaveMillis = now;
            dirty = false;
            return true;
        } catch (IOException e) {
            log.error("数据库保存失败: {}", path, e);
            dirty = true;
            return false;
        }
    }

    private static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public boolean isDirty() {
        return dirty;
    }

    @Override
    public void markDirty() {
        dirty = true;
    }

    @Override
    public boolean backup(Path target, boolean flushPending) {
        Path destination = target == null ? defaultBackupPath() : target;
        if (flushPending && (dirty || !Files.exists(path)) && !save(true)) {
            return false;
        }
        try {
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.copy(path, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            log.info("数据库已备份到: {}", destination);
            return true;
        } catch (IOException e) {
            log.error("备份失败: {}", destination, e);
            return false;
        }
    }

    @Override
    public Path defaultBackupPath() {
        String suffix = LocalDateTime.now(clock).format(BACKUP_SUFFIX);
        return path.resolveSibling(path.getFileName() + ".backup_" + suffix);
    }

    @Override
    public boolean restore(Path source) {
        if (source == null || !Files.isRegularFile(source)) {
            log.error("恢复失败，备份文件不存在: {}", source);
            return false;
        }
        try {
            Files.copy(source, path, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.error("恢复失败: {}", source, e);
            return false;
        }
        createdAt = null;
        load();
        lastSaveMillis = clock.millis();
        log.info("已从备份恢复: {}", source);
        return true;
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public long fileSize() {
        try {
            return Files.exists(path) ? Files.size(path) : 0L;
        } catch (IOException e) {
            log.warn("无法读取文件大小: {}", path, e);
            return 0L;
        }
    }
}
