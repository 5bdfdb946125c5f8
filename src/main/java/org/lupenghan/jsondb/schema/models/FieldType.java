package org.lupenghan.jsondb.schema.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * 字段类型枚举（JSON 语义类型）
 */
@Getter
public enum FieldType {
    STRING("string", "str"),
    INTEGER("integer", "int"),
    NUMBER("number", "float"),
    BOOLEAN("boolean", "bool"),
    OBJECT("object", "dict"),
    ARRAY("array", "list"),
    ANY("any", "any");

    @JsonValue
    private final String jsonName;
    private final String alias;

    FieldType(String jsonName, String alias) {
        this.jsonName = jsonName;
        this.alias = alias;
    }

    @JsonCreator
    public static FieldType fromName(String name) {
        for (FieldType type : values()) {
            if (type.jsonName.equalsIgnoreCase(name) || type.alias.equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知的字段类型: " + name);
    }

    public boolean matches(Object value) {
        return switch (this) {
            case STRING -> value instanceof String;
            case INTEGER -> value instanceof Integer || value instanceof Long || value instanceof Short
                    || value instanceof Byte || value instanceof BigInteger;
            case NUMBER -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case OBJECT -> value instanceof Map;
            case ARRAY -> value instanceof List;
            case ANY -> true;
        };
    }
}
