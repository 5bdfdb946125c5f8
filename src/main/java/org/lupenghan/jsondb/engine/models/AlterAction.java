package org.lupenghan.jsondb.engine.models;

/**
 * 表结构修改类型
 */
public enum AlterAction {
    ADD_COLUMN,
    DROP_COLUMN,
    MODIFY_COLUMN
}
