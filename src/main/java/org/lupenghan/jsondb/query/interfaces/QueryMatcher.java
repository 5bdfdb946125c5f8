package org.lupenghan.jsondb.query.interfaces;

import org.lupenghan.jsondb.query.models.Condition;
import org.lupenghan.jsondb.query.models.QueryPlan;

import java.util.List;
import java.util.Map;

public interface QueryMatcher {
    boolean match(Map<String, Object> record, Condition condition);

    /**
     * 按条件查询，返回表内记录本身（调用方负责拷贝）
     * @param limit 为 null 或小于等于 0 时不限制
     * @param offset 跳过的记录数
     */
    List<Map<String, Object>> select(String tableName, Condition condition, Integer limit, int offset);

    int count(String tableName, Condition condition);

    QueryPlan explain(String tableName, Condition condition);
}
