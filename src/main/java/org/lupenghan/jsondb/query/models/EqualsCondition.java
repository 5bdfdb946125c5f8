package org.lupenghan.jsondb.query.models;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.lupenghan.jsondb.common.utils.Values;

import java.util.Map;

/**
 * 等值条件，字段缺失视为不匹配
 */
@Getter
@ToString
@AllArgsConstructor
public class EqualsCondition implements FieldCondition {
    private final String field;
    private final Object value;

    @Override
    public boolean test(Map<String, Object> record) {
        return record.containsKey(field) && Values.valuesEqual(record.get(field), value);
    }
}
