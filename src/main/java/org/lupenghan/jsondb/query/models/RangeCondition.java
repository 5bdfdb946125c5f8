package org.lupenghan.jsondb.query.models;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.lupenghan.jsondb.common.utils.Values;

import java.util.Map;
import java.util.function.IntPredicate;

/**
 * 范围条件，$gt/$gte/$lt/$lte 之间为 AND 关系
 * 字段缺失或类型不可比较时不匹配
 */
@Getter
@Builder
@ToString
public class RangeCondition implements FieldCondition {
    private final String field;
    private final Object gt;
    private final Object gte;
    private final Object lt;
    private final Object lte;
    // 用于区分 "$gt": null 与未给出 $gt
    private final boolean hasGt;
    private final boolean hasGte;
    private final boolean hasLt;
    private final boolean hasLte;

    @Override
    public boolean test(Map<String, Object> record) {
        if (!record.containsKey(field)) {
            return false;
        }
        Object value = record.get(field);
        if (hasGt && !holds(value, gt, c -> c > 0)) return false;
        if (hasGte && !holds(value, gte, c -> c >= 0)) return false;
        if (hasLt && !holds(value, lt, c -> c < 0)) return false;
        if (hasLte && !holds(value, lte, c -> c <= 0)) return false;
        return true;
    }

    private static boolean holds(Object value, Object bound, IntPredicate check) {
        Integer cmp = Values.compare(value, bound);
        return cmp != null && check.test(cmp);
    }
}
