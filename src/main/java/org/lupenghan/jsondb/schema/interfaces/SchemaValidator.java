package org.lupenghan.jsondb.schema.interfaces;

import org.lupenghan.jsondb.common.DbException;
import org.lupenghan.jsondb.schema.models.FieldConstraint;

import java.util.Map;

public interface SchemaValidator {
    /**
     * 用表结构检查候选记录（已有字段 + 将要写入的字段）
     * @param tableName 表名，仅用于错误消息
     * @param schema 表结构，为 null 表示该表不做校验
     * @param candidate 候选记录
     * @throws DbException 类型为 VALIDATION，消息中包含字段名
     */
    void validate(String tableName, Map<String, FieldConstraint> schema, Map<String, Object> candidate);
}
