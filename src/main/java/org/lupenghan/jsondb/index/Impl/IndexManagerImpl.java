package org.lupenghan.jsondb.index.Impl;

import lombok.extern.slf4j.Slf4j;
import org.lupenghan.jsondb.common.DbException;
import org.lupenghan.jsondb.index.interfaces.IndexManager;
import org.lupenghan.jsondb.index.models.ColumnIndex;
import org.lupenghan.jsondb.storage.models.DatabaseState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
public class IndexManagerImpl implements IndexManager {
    private final DatabaseState state;

    public IndexManagerImpl(DatabaseState state) {
        this.state = state;
    }

    @Override
    public boolean createIndex(String tableName, String column) {
        if (!state.hasTable(tableName)) {
            throw DbException.tableNotFound(tableName);
        }
        Map<String, ColumnIndex> columns = state.getIndexes().computeIfAbsent(tableName, k -> new LinkedHashMap<>());
        if (columns.containsKey(column)) {
            return false;
        }
        columns.put(column, build(column, state.records(tableName)));
        log.debug("为表 {} 的列 {} 建立索引", tableName, column);
        return true;
    }

    @Override
    public boolean dropIndex(String tableName, String column) {
        Map<String, ColumnIndex> columns = state.tableIndexes(tableName);
        if (columns == null || columns.remove(column) == null) {
            return false;
        }
        log.debug("删除表 {} 的列 {} 上的索引", tableName, column);
        return true;
    }

    @Override
    public boolean hasIndex(String tableName, String column) {
        Map<String, ColumnIndex> columns = state.tableIndexes(tableName);
        return columns != null && columns.containsKey(column);
    }

    @Override
    public List<String> listIndexes(String tableName) {
        if (!state.hasTable(tableName)) {
            throw DbException.tableNotFound(tableName);
        }
        Map<String, ColumnIndex> columns = state.tableIndexes(tableName);
        return columns == null ? new ArrayList<>() : new ArrayList<>(columns.keySet());
    }

    @Override
    public void onInsert(String tableName, Map<String, Object> record, int position) {
        Map<String, ColumnIndex> columns = state.tableIndexes(tableName);
        if (columns == null) {
            return;
        }
        for (ColumnIndex index : columns.values()) {
            if (record.containsKey(index.getColumn())) {
                index.add(record.get(index.getColumn()), position);
            }
        }
    }

    @Override
    public void rebuildAll(String tableName) {
        Map<String, ColumnIndex> columns = state.tableIndexes(tableName);
        if (columns == null || columns.isEmpty()) {
            return;
        }
        List<Map<String, Object>> records = state.records(tableName);
        for (String column : new ArrayList<>(columns.keySet())) {
            columns.put(column, build(column, records));
        }
        log.debug("重建表 {} 的 {} 个索引", tableName, columns.size());
    }

    @Override
    public List<Integer> lookup(String tableName, String column, Object value) {
        Map<String, ColumnIndex> columns = state.tableIndexes(tableName);
        if (columns == null || !columns.containsKey(column)) {
            return Collections.emptyList();
        }
        return columns.get(column).positions(value);
    }

    @Override
    public void clear(String tableName) {
        Map<String, ColumnIndex> columns = state.tableIndexes(tableName);
        if (columns != null) {
            columns.values().forEach(ColumnIndex::clear);
        }
    }

    @Override
    public void removeTable(String tableName) {
        state.getIndexes().remove(tableName);
    }

    @Override
    public void renameTable(String oldName, String newName) {
        Map<String, ColumnIndex> columns = state.getIndexes().remove(oldName);
        state.getIndexes().put(newName, columns == null ? new LinkedHashMap<>() : columns);
    }

    @Override
    public void restore(String tableName, Collection<String> columns) {
        Map<String, ColumnIndex> restored = new LinkedHashMap<>();
        List<Map<String, Object>> records = state.records(tableName);
        for (String column : columns) {
            restored.put(column, build(column, records == null ? Collections.emptyList() : records));
        }
        state.getIndexes().put(tableName, restored);
    }

    @Override
    public Map<String, Map<String, Map<String, List<Integer>>>> toPersistedForm() {
        Map<String, Map<String, Map<String, List<Integer>>>> persisted = new LinkedHashMap<>();
        state.getIndexes().forEach((tableName, columns) -> {
            Map<String, Map<String, List<Integer>>> table = new LinkedHashMap<>();
            columns.forEach((column, index) -> table.put(column, index.toPersistedForm()));
            persisted.put(tableName, table);
        });
        return persisted;
    }

    private ColumnIndex build(String column, List<Map<String, Object>> records) {
        ColumnIndex index = new ColumnIndex(column);
        for (int i = 0; i < records.size(); i++) {
            Map<String, Object> record = records.get(i);
            if (record.containsKey(column)) {
                index.add(record.get(column), i);
            }
        }
        return index;
    }
}
