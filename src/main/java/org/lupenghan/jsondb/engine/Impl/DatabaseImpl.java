package org.lupenghan.jsondb.engine.Impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import org.lupenghan.jsondb.aggregate.Impl.AggregationPipelineImpl;
import org.lupenghan.jsondb.aggregate.interfaces.AggregationPipeline;
import org.lupenghan.jsondb.common.DbConfig;
import org.lupenghan.jsondb.common.DbException;
import org.lupenghan.jsondb.common.ErrorKind;
import org.lupenghan.jsondb.common.utils.Values;
import org.lupenghan.jsondb.engine.interfaces.Database;
import org.lupenghan.jsondb.engine.models.AlterCommand;
import org.lupenghan.jsondb.engine.models.DatabaseInfo;
import org.lupenghan.jsondb.engine.models.ImportMode;
import org.lupenghan.jsondb.engine.models.ImportResult;
import org.lupenghan.jsondb.engine.models.TableAnalysis;
import org.lupenghan.jsondb.engine.models.TableInfo;
import org.lupenghan.jsondb.index.Impl.IndexManagerImpl;
import org.lupenghan.jsondb.index.interfaces.IndexManager;
import org.lupenghan.jsondb.query.Impl.QueryMatcherImpl;
import org.lupenghan.jsondb.query.interfaces.QueryMatcher;
import org.lupenghan.jsondb.query.models.Condition;
import org.lupenghan.jsondb.query.models.QueryPlan;
import org.lupenghan.jsondb.schema.Impl.SchemaValidatorImpl;
import org.lupenghan.jsondb.schema.interfaces.SchemaValidator;
import org.lupenghan.jsondb.schema.models.FieldConstraint;
import org.lupenghan.jsondb.schema.models.FieldType;
import org.lupenghan.jsondb.storage.Impl.JsonFilePersistenceManager;
import org.lupenghan.jsondb.storage.interfaces.PersistenceManager;
import org.lupenghan.jsondb.storage.models.DatabaseState;
import org.lupenghan.jsondb.transaction.Impl.TransactionManagerImpl;
import org.lupenghan.jsondb.transaction.interfaces.TransactionManager;
import org.lupenghan.jsondb.transaction.models.TransactionBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.NOPLogger;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 数据库门面：校验输入、修改内存状态、维护索引，事务之外的修改触发保存
 */
public class DatabaseImpl implements Database {
    public static final String ID = "_id";
    public static final String CREATED_AT = "_created_at";
    public static final String UPDATED_AT = "_updated_at";

    private static final int MAX_TABLE_NAME_LENGTH = 64;
    private static final Pattern TABLE_NAME = Pattern.compile("[\\p{L}\\p{N}_-]+");
    private static final String COUNT_QUERY = "SELECT COUNT(*) FROM";
    private static final String SHOW_TABLES_QUERY = "SHOW TABLES";

    @Getter
    private final DbConfig config;
    private final Logger log;
    private final DatabaseState state;
    private final SchemaValidator schemaValidator;
    private final IndexManager indexManager;
    private final QueryMatcher queryMatcher;
    private final PersistenceManager persistenceManager;
    private final TransactionManager transactionManager;
    private final AggregationPipeline aggregationPipeline;
    private final ObjectMapper mapper = new ObjectMapper();

    public DatabaseImpl(DbConfig config) {
        this.config = config;
        this.log = config.isEnableLogging() ? LoggerFactory.getLogger(DatabaseImpl.class) : NOPLogger.NOP_LOGGER;
        this.state = new DatabaseState();
        this.schemaValidator = new SchemaValidatorImpl();
        this.indexManager = new IndexManagerImpl(state);
        this.queryMatcher = new QueryMatcherImpl(state, indexManager);
        this.persistenceManager = new JsonFilePersistenceManager(config, state, indexManager);
        this.transactionManager = new TransactionManagerImpl(state, persistenceManager, config.getClock());
        this.aggregationPipeline = new AggregationPipelineImpl(state);
        persistenceManager.load();
        log.info("打开数据库 {}，共 {} 个表", config.getPath(), state.getTables().size());
    }

    // ---------------- 表管理 ----------------

    @Override
    public boolean createTable(String tableName) {
        return createTable(tableName, null);
    }

    @Override
    public boolean createTable(String tableName, Map<String, FieldConstraint> schema) {
        validateTableName(tableName);
        if (state.hasTable(tableName)) {
            return false;
        }
        state.getTables().put(tableName, new ArrayList<>());
        indexManager.restore(tableName, new ArrayList<>());
        if (schema != null && !schema.isEmpty()) {
            state.getSchemas().put(tableName, DatabaseState.copySchema(schema));
        }
        log.info("创建表: {}", tableName);
        persist();
        return true;
    }

    @Override
    public boolean dropTable(String tableName) {
        if (!state.hasTable(tableName)) {
            return false;
        }
        state.getTables().remove(tableName);
        state.getSchemas().remove(tableName);
        indexManager.removeTable(tableName);
        log.info("删除表: {}", tableName);
        persist();
        return true;
    }

    @Override
    public boolean renameTable(String oldName, String newName) {
        validateTableName(newName);
        if (!state.hasTable(oldName) || state.hasTable(newName)) {
            return false;
        }
        state.getTables().put(newName, state.getTables().remove(oldName));
        Map<String, FieldConstraint> schema = state.getSchemas().remove(oldName);
        if (schema != null) {
            state.getSchemas().put(newName, schema);
        }
        indexManager.renameTable(oldName, newName);
        log.info("重命名表: {} -> {}", oldName, newName);
        persist();
        return true;
    }

    @Override
    public boolean truncateTable(String tableName) {
        if (!state.hasTable(tableName)) {
            return false;
        }
        state.records(tableName).clear();
        indexManager.clear(tableName);
        log.info("清空表: {}", tableName);
        persist();
        return true;
    }

    @Override
    public boolean alterTable(String tableName, AlterCommand command) {
        if (!state.hasTable(tableName)) {
            return false;
        }
        if (command == null || command.getAction() == null || command.getColumnName() == null) {
            throw DbException.validation("ALTER TABLE 需要指定操作类型和列名");
        }
        String column = command.getColumnName();
        List<Map<String, Object>> records = state.records(tableName);
        Map<String, FieldConstraint> schema = state.schema(tableName);

        switch (command.getAction()) {
            case ADD_COLUMN -> {
                Object defaultValue = Values.deepCopy(command.getDefaultValue());
                if (schema != null) {
                    schema.put(column, command.getColumnDef() == null ? new FieldConstraint() : command.getColumnDef().copy());
                }
                for (Map<String, Object> record : records) {
                    if (!record.containsKey(column)) {
                        record.put(column, Values.deepCopy(defaultValue));
                    }
                }
                indexManager.rebuildAll(tableName);
            }
            case DROP_COLUMN -> {
                if (schema != null) {
                    schema.remove(column);
                }
                for (Map<String, Object> record : records) {
                    record.remove(column);
                }
                indexManager.dropIndex(tableName, column);
            }
            case MODIFY_COLUMN -> {
                if (command.getColumnDef() == null) {
                    throw DbException.validation("MODIFY_COLUMN 需要新的列定义");
                }
                Map<String, FieldConstraint> modified = schema == null
                        ? new LinkedHashMap<>() : DatabaseState.copySchema(schema);
                modified.put(column, command.getColumnDef().copy());
                // 只按被修改的列检查已有记录
                Map<String, FieldConstraint> single = Map.of(column, command.getColumnDef());
                for (Map<String, Object> record : records) {
                    schemaValidator.validate(tableName, single, record);
                }
                state.getSchemas().put(tableName, modified);
            }
        }
        log.info("修改表 {}: {} {}", tableName, command.getAction(), column);
        persist();
        return true;
    }

    @Override
    public List<String> listTables() {
        return state.tableNames();
    }

    @Override
    public Map<String, FieldConstraint> getSchema(String tableName) {
        Map<String, FieldConstraint> schema = state.schema(tableName);
        return schema == null ? null : DatabaseState.copySchema(schema);
    }

    @Override
    public boolean setSchema(String tableName, Map<String, FieldConstraint> schema) {
        if (!state.hasTable(tableName)) {
            return false;
        }
        if (schema == null || schema.isEmpty()) {
            state.getSchemas().remove(tableName);
        } else {
            state.getSchemas().put(tableName, DatabaseState.copySchema(schema));
        }
        persist();
        return true;
    }

    @Override
    public TableInfo getTableInfo(String tableName) {
        if (!state.hasTable(tableName)) {
            return null;
        }
        List<Map<String, Object>> records = state.records(tableName);
        Map<String, FieldConstraint> schema = getSchema(tableName);
        return TableInfo.builder()
                .name(tableName)
                .recordCount(records.size())
                .schema(schema == null ? new LinkedHashMap<>() : schema)
                .indexes(indexManager.listIndexes(tableName))
                .sizeBytes(toJsonBytes(records).length)
                .build();
    }

    @Override
    public TableAnalysis analyzeTable(String tableName) {
        if (!state.hasTable(tableName)) {
            return null;
        }
        List<Map<String, Object>> records = state.records(tableName);
        TableAnalysis analysis = new TableAnalysis();
        analysis.setRecordCount(records.size());
        Map<String, Set<String>> distinct = new LinkedHashMap<>();
        for (Map<String, Object> record : records) {
            for (Map.Entry<String, Object> field : record.entrySet()) {
                String column = field.getKey();
                Object value = field.getValue();
                if (!distinct.containsKey(column)) {
                    distinct.put(column, new HashSet<>());
                    analysis.getDataTypes().put(column, typeName(value));
                    analysis.getNullCounts().put(column, 0);
                }
                if (value == null) {
                    analysis.getNullCounts().merge(column, 1, Integer::sum);
                } else {
                    distinct.get(column).add(Values.stringKey(value));
                }
            }
        }
        distinct.forEach((column, values) -> analysis.getUniqueCounts().put(column, values.size()));
        return analysis;
    }

    @Override
    public boolean optimizeTable(String tableName) {
        if (!state.hasTable(tableName)) {
            return false;
        }
        List<Map<String, Object>> records = state.records(tableName);
        for (int i = 0; i < records.size(); i++) {
            records.get(i).put(ID, i + 1);
        }
        indexManager.rebuildAll(tableName);
        log.info("优化表 {}: 重新编号 {} 条记录", tableName, records.size());
        persist();
        return true;
    }

    @Override
    public boolean vacuum() {
        requireNoTransaction("vacuum");
        for (String tableName : state.tableNames()) {
            optimizeTable(tableName);
        }
        if (!persistenceManager.save(true)) {
            log.error("数据库维护失败: 无法保存");
            return false;
        }
        persistenceManager.load();
        log.info("数据库维护完成");
        return true;
    }

    @Override
    public DatabaseInfo getDatabaseInfo() {
        Map<String, TableInfo> tables = new LinkedHashMap<>();
        for (String tableName : state.tableNames()) {
            tables.put(tableName, getTableInfo(tableName));
        }
        return DatabaseInfo.builder()
                .databasePath(config.getPath().toString())
                .tableCount(state.getTables().size())
                .totalRecords(state.totalRecords())
                .totalIndexes(state.totalIndexes())
                .tables(tables)
                .fileSizeBytes(persistenceManager.fileSize())
                .build();
    }

    // ---------------- 记录操作 ----------------

    @Override
    public Map<String, Object> insert(String tableName, Map<String, ?> record) {
        List<Map<String, Object>> records = requireTable(tableName);
        if (records.size() >= config.getMaxRecordsPerTable()) {
            throw DbException.engine("表 '" + tableName + "' 已达到最大记录数限制 (" + config.getMaxRecordsPerTable() + ")");
        }
        if (record == null) {
            throw DbException.validation("插入的记录不能为空");
        }
        Map<String, Object> candidate = Values.copyRecord(record);
        schemaValidator.validate(tableName, state.schema(tableName), candidate);

        candidate.put(CREATED_AT, now());
        candidate.put(ID, records.size() + 1);
        int position = records.size();
        indexManager.onInsert(tableName, candidate, position);
        records.add(candidate);
        log.debug("向表 {} 插入记录 _id={}", tableName, position + 1);
        persist();
        return Values.copyRecord(candidate);
    }

    @Override
    public List<Map<String, Object>> select(String tableName) {
        return select(tableName, null, null, 0);
    }

    @Override
    public List<Map<String, Object>> select(String tableName, Map<String, ?> condition) {
        return select(tableName, condition, null, 0);
    }

    @Override
    public List<Map<String, Object>> select(String tableName, Map<String, ?> condition, Integer limit, int offset) {
        List<Map<String, Object>> rows = queryMatcher.select(tableName, Condition.parse(condition), limit, offset);
        return Values.copyRecords(rows);
    }

    @Override
    public int update(String tableName, Map<String, ?> condition, Map<String, ?> values) {
        List<Map<String, Object>> records = requireTable(tableName);
        if (condition == null || condition.isEmpty()) {
            throw DbException.engine("更新操作必须提供条件");
        }
        Condition parsed = Condition.parse(condition);
        Map<String, Object> changes = values == null ? new LinkedHashMap<>() : Values.copyRecord(values);
        Map<String, FieldConstraint> schema = state.schema(tableName);

        // 先校验全部候选记录，全部通过后再写入
        List<Map.Entry<Integer, Map<String, Object>>> pending = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            Map<String, Object> record = records.get(i);
            if (!queryMatcher.match(record, parsed)) {
                continue;
            }
            Map<String, Object> candidate = Values.copyRecord(record);
            candidate.putAll(Values.copyRecord(changes));
            schemaValidator.validate(tableName, schema, candidate);
            pending.add(new AbstractMap.SimpleEntry<>(i, candidate));
        }
        if (pending.isEmpty()) {
            return 0;
        }
        String updatedAt = now();
        for (Map.Entry<Integer, Map<String, Object>> entry : pending) {
            entry.getValue().put(UPDATED_AT, updatedAt);
            records.set(entry.getKey(), entry.getValue());
        }
        indexManager.rebuildAll(tableName);
        log.info("更新表 {}: {} 条记录", tableName, pending.size());
        persist();
        return pending.size();
    }

    @Override
    public int delete(String tableName, Map<String, ?> condition) {
        List<Map<String, Object>> records = requireTable(tableName);
        if (condition == null || condition.isEmpty()) {
            throw DbException.engine("删除操作必须提供条件");
        }
        Condition parsed = Condition.parse(condition);
        int before = records.size();
        records.removeIf(record -> queryMatcher.match(record, parsed));
        int deleted = before - records.size();
        if (deleted > 0) {
            indexManager.rebuildAll(tableName);
            log.info("从表 {} 删除 {} 条记录", tableName, deleted);
            persist();
        }
        return deleted;
    }

    @Override
    public int count(String tableName) {
        return count(tableName, null);
    }

    @Override
    public int count(String tableName, Map<String, ?> condition) {
        return queryMatcher.count(tableName, Condition.parse(condition));
    }

    @Override
    public ImportResult importData(String tableName, List<Map<String, Object>> records, ImportMode mode) {
        requireTable(tableName);
        ImportMode effective = mode == null ? ImportMode.INSERT : mode;
        ImportResult result = new ImportResult();
        if (records == null || records.isEmpty()) {
            return result;
        }
        TransactionBody body = () -> {
            for (Map<String, Object> record : records) {
                if (record == null) {
                    result.countSkipped();
                    continue;
                }
                try {
                    importOne(tableName, record, effective);
                    result.countImported();
                } catch (DbException e) {
                    result.countError();
                    log.error("导入记录失败: {}", e.getMessage());
                }
            }
        };
        if (transactionManager.isActive()) {
            // 已在外层事务中，随外层事务一起提交或回滚
            runInline(body);
        } else {
            transactionManager.execute(body);
        }
        log.info("导入表 {}: {}", tableName, result);
        return result;
    }

    private void importOne(String tableName, Map<String, Object> record, ImportMode mode) {
        Object id = record.get(ID);
        switch (mode) {
            case INSERT -> insert(tableName, record);
            case REPLACE -> {
                if (id != null) {
                    delete(tableName, Map.of(ID, id));
                }
                insert(tableName, record);
            }
            case UPDATE -> {
                if (id == null || update(tableName, Map.of(ID, id), record) == 0) {
                    insert(tableName, record);
                }
            }
        }
    }

    private static void runInline(TransactionBody body) {
        try {
            body.run();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new DbException(ErrorKind.ENGINE, e.getMessage(), e);
        }
    }

    @Override
    public String exportData(String tableName, Map<String, ?> condition) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(select(tableName, condition));
        } catch (JsonProcessingException e) {
            throw new DbException(ErrorKind.IO, "导出表 '" + tableName + "' 失败", e);
        }
    }

    // ---------------- 索引 ----------------

    @Override
    public boolean createIndex(String tableName, String column) {
        boolean created = indexManager.createIndex(tableName, column);
        if (created) {
            log.info("为表 {} 的列 {} 创建索引", tableName, column);
            persist();
        }
        return created;
    }

    @Override
    public boolean dropIndex(String tableName, String column) {
        boolean dropped = indexManager.dropIndex(tableName, column);
        if (dropped) {
            log.info("删除表 {} 的列 {} 上的索引", tableName, column);
            persist();
        }
        return dropped;
    }

    @Override
    public List<String> listIndexes(String tableName) {
        return indexManager.listIndexes(tableName);
    }

    @Override
    public QueryPlan explainQuery(String tableName, Map<String, ?> condition) {
        return queryMatcher.explain(tableName, Condition.parse(condition));
    }

    // ---------------- 聚合 ----------------

    @Override
    public List<Map<String, Object>> aggregate(String tableName, List<Map<String, Object>> pipeline) {
        return Values.copyRecords(aggregationPipeline.aggregate(tableName, pipeline));
    }

    @Override
    public Object executeQuery(String query) {
        String text = query == null ? "" : query.trim();
        if (text.endsWith(";")) {
            text = text.substring(0, text.length() - 1).trim();
        }
        String upper = text.toUpperCase(Locale.ROOT);
        if (upper.startsWith(COUNT_QUERY)) {
            // 关键字不区分大小写，表名保持原样
            String tableName = text.substring(COUNT_QUERY.length()).trim();
            if (tableName.isEmpty()) {
                throw DbException.engine("查询语句缺少表名: " + text);
            }
            return count(tableName);
        }
        if (upper.startsWith(SHOW_TABLES_QUERY)) {
            return listTables();
        }
        throw DbException.engine("不支持的查询语句: " + text);
    }

    // ---------------- 持久化 ----------------

    @Override
    public boolean save() {
        return persist();
    }

    @Override
    public boolean flush() {
        requireNoTransaction("flush");
        return persistenceManager.save(true);
    }

    @Override
    public boolean backup() {
        return backup(null);
    }

    @Override
    public boolean backup(Path target) {
        // 事务中只复制已提交的文件内容
        return persistenceManager.backup(target, !transactionManager.isActive());
    }

    @Override
    public boolean restore(Path source) {
        requireNoTransaction("restore");
        return persistenceManager.restore(source);
    }

    // ---------------- 事务 ----------------

    @Override
    public void transaction(TransactionBody body) {
        try {
            transactionManager.execute(body);
            log.info("事务提交成功");
        } catch (RuntimeException | Error e) {
            log.warn("事务失败: {}", e.getMessage());
            throw e;
        }
    }

    @Override
    public void begin() {
        transactionManager.begin();
        log.info("开始事务");
    }

    @Override
    public boolean commit() {
        boolean saved = transactionManager.commit();
        log.info("提交事务");
        return saved;
    }

    @Override
    public void rollback() {
        transactionManager.rollback();
        log.info("回滚事务");
    }

    @Override
    public boolean isTransactionActive() {
        return transactionManager.isActive();
    }

    @Override
    public void close() {
        if (transactionManager.isActive()) {
            log.warn("关闭数据库时仍有未提交的事务，执行回滚");
            transactionManager.rollback();
        }
        if (persistenceManager.isDirty()) {
            persistenceManager.save(true);
        }
        log.info("关闭数据库 {}", config.getPath());
    }

    // ---------------- 内部方法 ----------------

    /**
     * 事务体执行期间只标记为未保存，由提交统一写入
     */
    private boolean persist() {
        if (transactionManager.isActive()) {
            persistenceManager.markDirty();
            return true;
        }
        return persistenceManager.save(false);
    }

    private List<Map<String, Object>> requireTable(String tableName) {
        List<Map<String, Object>> records = state.records(tableName);
        if (records == null) {
            throw DbException.tableNotFound(tableName);
        }
        return records;
    }

    private void requireNoTransaction(String operation) {
        if (transactionManager.isActive()) {
            throw DbException.engine("事务进行中不能执行 " + operation);
        }
    }

    private static void validateTableName(String tableName) {
        if (tableName == null || tableName.isEmpty()) {
            throw DbException.validation("表名必须是非空字符串");
        }
        if (tableName.length() > MAX_TABLE_NAME_LENGTH) {
            throw DbException.validation("表名长度不能超过" + MAX_TABLE_NAME_LENGTH + "个字符");
        }
        if (!TABLE_NAME.matcher(tableName).matches()) {
            throw DbException.validation("表名只能包含字母、数字、下划线和连字符");
        }
    }

    private String now() {
        return LocalDateTime.now(config.getClock()).toString();
    }

    private byte[] toJsonBytes(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new DbException(ErrorKind.IO, "序列化失败", e);
        }
    }

    private static String typeName(Object value) {
        if (value == null) {
            return "null";
        }
        for (FieldType type : FieldType.values()) {
            if (type != FieldType.ANY && type.matches(value)) {
                return type.getJsonName();
            }
        }
        return value.getClass().getSimpleName();
    }
}
