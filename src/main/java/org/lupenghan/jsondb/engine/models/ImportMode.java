package org.lupenghan.jsondb.engine.models;

/**
 * 批量导入模式
 */
public enum ImportMode {
    // 全部作为新记录插入
    INSERT,
    // 先删除 _id 相同的记录再插入
    REPLACE,
    // 按 _id 更新，没有匹配的记录时插入
    UPDATE
}
