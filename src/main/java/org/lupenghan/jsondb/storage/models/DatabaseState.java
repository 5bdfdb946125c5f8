package org.lupenghan.jsondb.storage.models;

import lombok.Getter;
import org.lupenghan.jsondb.common.utils.Values;
import org.lupenghan.jsondb.index.models.ColumnIndex;
import org.lupenghan.jsondb.schema.models.FieldConstraint;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 数据库内存状态：表数据、表结构、索引三张映射
 * 各组件共享同一个实例，恢复快照或重新加载时原地替换内容
 */
@Getter
public class DatabaseState {
    private final Map<String, List<Map<String, Object>>> tables = new LinkedHashMap<>();
    private final Map<String, Map<String, FieldConstraint>> schemas = new LinkedHashMap<>();
    private final Map<String, Map<String, ColumnIndex>> indexes = new LinkedHashMap<>();

    public boolean hasTable(String tableName) {
        return tables.containsKey(tableName);
    }

    public List<Map<String, Object>> records(String tableName) {
        return tables.get(tableName);
    }

    public Map<String, FieldConstraint> schema(String tableName) {
        return schemas.get(tableName);
    }

    public Map<String, ColumnIndex> tableIndexes(String tableName) {
        return indexes.get(tableName);
    }

    /**
     * 完全独立的深拷贝
     */
    public DatabaseState copy() {
        DatabaseState copy = new DatabaseState();
        tables.forEach((name, records) -> copy.tables.put(name, Values.copyRecords(records)));
        schemas.forEach((name, schema) -> copy.schemas.put(name, copySchema(schema)));
        indexes.forEach((name, columns) -> {
            Map<String, ColumnIndex> copied = new LinkedHashMap<>();
            columns.forEach((column, index) -> copied.put(column, index.copy()));
            copy.indexes.put(name, copied);
        });
        return copy;
    }

    public void replaceWith(DatabaseState other) {
        clear();
        tables.putAll(other.tables);
        schemas.putAll(other.schemas);
        indexes.putAll(other.indexes);
    }

    public void clear() {
        tables.clear();
        schemas.clear();
        indexes.clear();
    }

    public int totalRecords() {
        int total = 0;
        for (List<Map<String, Object>> records : tables.values()) {
            total += records.size();
        }
        return total;
    }

    public int totalIndexes() {
        int total = 0;
        for (Map<String, ColumnIndex> columns : indexes.values()) {
            total += columns.size();
        }
        return total;
    }

    public static Map<String, FieldConstraint> copySchema(Map<String, FieldConstraint> schema) {
        Map<String, FieldConstraint> copy = new LinkedHashMap<>();
        schema.forEach((field, constraint) -> copy.put(field, constraint == null ? null : constraint.copy()));
        return copy;
    }

    public List<String> tableNames() {
        return new ArrayList<>(tables.keySet());
    }
}
