package org.lupenghan.jsondb.query.models;

import lombok.Getter;
import lombok.ToString;
import org.lupenghan.jsondb.common.utils.Values;

import java.util.Locale;
import java.util.Map;

/**
 * 模糊匹配：忽略大小写的子串包含
 */
@Getter
@ToString
public class LikeCondition implements FieldCondition {
    private final String field;
    private final String pattern;

    public LikeCondition(String field, String pattern) {
        this.field = field;
        this.pattern = pattern.toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean test(Map<String, Object> record) {
        Object value = record.get(field);
        if (value == null) {
            return false;
        }
        return Values.text(value).toLowerCase(Locale.ROOT).contains(pattern);
    }
}
