package org.lupenghan.jsondb.query.Impl;

import lombok.extern.slf4j.Slf4j;
import org.lupenghan.jsondb.index.interfaces.IndexManager;
import org.lupenghan.jsondb.query.interfaces.QueryMatcher;
import org.lupenghan.jsondb.query.models.Condition;
import org.lupenghan.jsondb.query.models.EqualsCondition;
import org.lupenghan.jsondb.query.models.QueryPlan;
import org.lupenghan.jsondb.storage.models.DatabaseState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
public class QueryMatcherImpl implements QueryMatcher {
    private final DatabaseState state;
    private final IndexManager indexManager;

    public QueryMatcherImpl(DatabaseState state, IndexManager indexManager) {
        this.state = state;
        this.indexManager = indexManager;
    }

    @Override
    public boolean match(Map<String, Object> record, Condition condition) {
        return condition == null || condition.test(record);
    }

    @Override
    public List<Map<String, Object>> select(String tableName, Condition condition, Integer limit, int offset) {
        List<Map<String, Object>> records = state.records(tableName);
        if (records == null) {
            return new ArrayList<>();
        }
        if (condition == null || condition.isEmpty()) {
            return paginate(records, limit, offset);
        }

        Optional<EqualsCondition> indexed = indexedEquality(tableName, condition);
        List<Map<String, Object>> result = new ArrayList<>();
        if (indexed.isPresent()) {
            EqualsCondition equals = indexed.get();
            log.debug("表 {} 使用列 {} 上的索引查询", tableName, equals.getField());
            for (int position : indexManager.lookup(tableName, equals.getField(), equals.getValue())) {
                if (position < records.size()) {
                    result.add(records.get(position));
                }
            }
        } else {
            for (Map<String, Object> record : records) {
                if (condition.test(record)) {
                    result.add(record);
                }
            }
        }
        return paginate(result, limit, offset);
    }

    @Override
    public int count(String tableName, Condition condition) {
        List<Map<String, Object>> records = state.records(tableName);
        if (records == null) {
            return 0;
        }
        if (condition == null || condition.isEmpty()) {
            return records.size();
        }
        return select(tableName, condition, null, 0).size();
    }

    @Override
    public QueryPlan explain(String tableName, Condition condition) {
        Condition effective = condition == null ? Condition.empty() : condition;
        QueryPlan plan = QueryPlan.builder()
                .table(tableName)
                .scanType(QueryPlan.FULL_SCAN)
                .estimatedRows(0)
                .indexesUsed(new ArrayList<>())
                .condition(effective.getSource())
                .build();
        List<Map<String, Object>> records = state.records(tableName);
        if (records == null) {
            return plan;
        }
        plan.setEstimatedRows(records.size());
        indexedEquality(tableName, effective).ifPresent(equals -> {
            plan.setScanType(QueryPlan.INDEX_SCAN);
            plan.setIndexesUsed(Collections.singletonList(equals.getField()));
            plan.setEstimatedRows(indexManager.lookup(tableName, equals.getField(), equals.getValue()).size());
        });
        return plan;
    }

    // 只有单字段等值且该列有索引时才走索引
    private Optional<EqualsCondition> indexedEquality(String tableName, Condition condition) {
        return condition.singleEquality()
                .filter(equals -> indexManager.hasIndex(tableName, equals.getField()));
    }

    private static List<Map<String, Object>> paginate(List<Map<String, Object>> rows, Integer limit, int offset) {
        int from = Math.min(Math.max(offset, 0), rows.size());
        int to = (limit == null || limit <= 0) ? rows.size() : (int) Math.min((long) from + limit, rows.size());
        return new ArrayList<>(rows.subList(from, to));
    }
}
