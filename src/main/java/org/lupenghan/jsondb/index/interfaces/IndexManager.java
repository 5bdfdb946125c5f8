package org.lupenghan.jsondb.index.interfaces;

import java.util.Collection;
import java.util.List;
import java.util.Map;

public interface IndexManager {
    /**
     * 扫描一次当前记录建立索引
     * @return 索引已存在时返回 false
     * @throws org.lupenghan.jsondb.common.DbException 表不存在（TABLE_NOT_FOUND）
     */
    boolean createIndex(String tableName, String column);

    // 索引不存在时返回 false
    boolean dropIndex(String tableName, String column);

    boolean hasIndex(String tableName, String column);

    List<String> listIndexes(String tableName);

    // 新记录追加到 position 后调用
    void onInsert(String tableName, Map<String, Object> record, int position);

    // 记录位置发生移动（删除、更新、改列）后必须调用
    void rebuildAll(String tableName);

    List<Integer> lookup(String tableName, String column, Object value);

    // 清空表的所有索引内容，保留索引定义
    void clear(String tableName);

    void removeTable(String tableName);

    void renameTable(String oldName, String newName);

    // 按列名恢复索引定义并根据当前数据重建
    void restore(String tableName, Collection<String> columns);

    Map<String, Map<String, Map<String, List<Integer>>>> toPersistedForm();
}
