package org.lupenghan.jsondb.query.models;

import lombok.Getter;
import org.lupenghan.jsondb.common.DbException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 查询条件：在查询入口解析一次，所有字段条件之间为 AND 关系
 * <pre>
 * {"name": "张三"}                       等值
 * {"age": {"$gte": 18, "$lt": 60}}       范围
 * {"name": {"$like": "张"}}              模糊匹配
 * </pre>
 */
@Getter
public class Condition {
    public static final String GT = "$gt";
    public static final String GTE = "$gte";
    public static final String LT = "$lt";
    public static final String LTE = "$lte";
    public static final String LIKE = "$like";

    private static final Condition EMPTY = new Condition(Collections.emptyMap(), Collections.emptyList());

    private final Map<String, Object> source;
    private final List<FieldCondition> predicates;

    private Condition(Map<String, Object> source, List<FieldCondition> predicates) {
        this.source = source;
        this.predicates = predicates;
    }

    public static Condition empty() {
        return EMPTY;
    }

    public static Condition parse(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        List<FieldCondition> predicates = new ArrayList<>();
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            String field = entry.getKey();
            Object value = entry.getValue();
            if (isOperatorMap(value)) {
                parseOperators(field, (Map<?, ?>) value, predicates);
            } else {
                predicates.add(new EqualsCondition(field, value));
            }
        }
        return new Condition(Collections.unmodifiableMap(new LinkedHashMap<>(raw)), predicates);
    }

    public boolean isEmpty() {
        return predicates.isEmpty();
    }

    public boolean test(Map<String, Object> record) {
        for (FieldCondition predicate : predicates) {
            if (!predicate.test(record)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 条件只有一个字段且为等值时返回该条件，可以走索引
     */
    public Optional<EqualsCondition> singleEquality() {
        if (source.size() == 1 && predicates.size() == 1 && predicates.get(0) instanceof EqualsCondition) {
            return Optional.of((EqualsCondition) predicates.get(0));
        }
        return Optional.empty();
    }

    // 所有键都以 $ 开头的非空对象才是操作符对象，否则按嵌套对象做等值比较
    private static boolean isOperatorMap(Object value) {
        if (!(value instanceof Map) || ((Map<?, ?>) value).isEmpty()) {
            return false;
        }
        for (Object key : ((Map<?, ?>) value).keySet()) {
            if (!(key instanceof String) || !((String) key).startsWith("$")) {
                return false;
            }
        }
        return true;
    }

    private static void parseOperators(String field, Map<?, ?> operators, List<FieldCondition> predicates) {
        RangeCondition.RangeConditionBuilder range = RangeCondition.builder().field(field);
        boolean hasRange = false;
        for (Map.Entry<?, ?> op : operators.entrySet()) {
            String name = (String) op.getKey();
            Object operand = op.getValue();
            switch (name) {
                case GT -> range.gt(operand).hasGt(true);
                case GTE -> range.gte(operand).hasGte(true);
                case LT -> range.lt(operand).hasLt(true);
                case LTE -> range.lte(operand).hasLte(true);
                case LIKE -> {
                    if (!(operand instanceof String)) {
                        throw DbException.validation("字段 '" + field + "' 的 $like 操作数必须是字符串");
                    }
                    predicates.add(new LikeCondition(field, (String) operand));
                }
                default -> throw DbException.validation("字段 '" + field + "' 使用了不支持的操作符: " + name);
            }
            if (!LIKE.equals(name)) {
                hasRange = true;
            }
        }
        if (hasRange) {
            predicates.add(range.build());
        }
    }

    @Override
    public String toString() {
        return source.toString();
    }
}
