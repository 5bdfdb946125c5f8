package org.lupenghan.jsondb.query.models;

import java.util.Map;

/**
 * 单个字段上的条件：Equals | Range | Like
 */
public interface FieldCondition {
    String getField();

    boolean test(Map<String, Object> record);
}
