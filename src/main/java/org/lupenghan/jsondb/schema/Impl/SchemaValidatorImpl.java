package org.lupenghan.jsondb.schema.Impl;

import org.lupenghan.jsondb.common.DbException;
import org.lupenghan.jsondb.common.utils.Values;
import org.lupenghan.jsondb.schema.interfaces.SchemaValidator;
import org.lupenghan.jsondb.schema.models.FieldConstraint;

import java.util.Map;

public class SchemaValidatorImpl implements SchemaValidator {

    @Override
    public void validate(String tableName, Map<String, FieldConstraint> schema, Map<String, Object> candidate) {
        if (schema == null) {
            return;
        }
        for (Map.Entry<String, FieldConstraint> entry : schema.entrySet()) {
            String field = entry.getKey();
            FieldConstraint constraint = entry.getValue();
            if (constraint == null) {
                continue;
            }
            if (!candidate.containsKey(field)) {
                if (constraint.isRequired()) {
                    throw DbException.validation("表 '" + tableName + "' 的必填字段 '" + field + "' 缺失");
                }
                continue;
            }

            Object value = candidate.get(field);
            if (constraint.getType() != null && !constraint.getType().matches(value)) {
                throw DbException.validation("字段 '" + field + "' 类型错误，期望 "
                        + constraint.getType().getJsonName());
            }
            Integer maxLength = constraint.getMaxLength();
            if (maxLength != null && value != null && Values.text(value).length() > maxLength) {
                throw DbException.validation("字段 '" + field + "' 长度超过限制 (" + maxLength + ")");
            }
        }
    }
}
