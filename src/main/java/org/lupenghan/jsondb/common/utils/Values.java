package org.lupenghan.jsondb.common.utils;

import org.lupenghan.jsondb.common.DbException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 记录字段值工具：深拷贝、数值归一化、比较
 * 字段值只允许 JSON 类型：String、Number、Boolean、null、Map、List
 */
public final class Values {

    private Values() {
    }

    /**
     * 深拷贝一条记录，键保持插入顺序
     */
    public static Map<String, Object> copyRecord(Map<String, ?> record) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : record.entrySet()) {
            copy.put(entry.getKey(), deepCopy(entry.getValue()));
        }
        return copy;
    }

    public static List<Map<String, Object>> copyRecords(List<Map<String, Object>> records) {
        List<Map<String, Object>> copy = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            copy.add(copyRecord(record));
        }
        return copy;
    }

    /**
     * 按值深拷贝，遇到非 JSON 类型抛出校验错误
     */
    public static Object deepCopy(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number) {
            if (isSupportedNumber(value)) {
                return value;
            }
            throw DbException.validation("不支持的数值类型: " + value.getClass().getName());
        }
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                if (!(entry.getKey() instanceof String)) {
                    throw DbException.validation("嵌套对象的键必须是字符串: " + entry.getKey());
                }
                copy.put((String) entry.getKey(), deepCopy(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof Collection) {
            Collection<?> collection = (Collection<?>) value;
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object item : collection) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        throw DbException.validation("不支持的字段值类型: " + value.getClass().getName());
    }

    /**
     * 归一化后的值，用作索引和分组的键：30、30L、30.0 得到同一个键
     */
    public static Object normalize(Object value) {
        if (value instanceof Number) {
            BigDecimal decimal = toBigDecimal((Number) value);
            return decimal == null ? value : decimal.stripTrailingZeros();
        }
        if (value instanceof Map) {
            Map<Object, Object> normalized = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> normalized.put(k, normalize(v)));
            return normalized;
        }
        if (value instanceof List) {
            List<?> list = (List<?>) value;
            List<Object> normalized = new ArrayList<>(list.size());
            for (Object item : list) {
                normalized.add(normalize(item));
            }
            return normalized;
        }
        return value;
    }

    public static boolean valuesEqual(Object a, Object b) {
        return Objects.equals(normalize(a), normalize(b));
    }

    /**
     * 比较两个值，类型不可比较时返回 null
     */
    public static Integer compare(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            Number x = (Number) a;
            Number y = (Number) b;
            BigDecimal left = toBigDecimal(x);
            BigDecimal right = toBigDecimal(y);
            if (left == null || right == null) {
                return Double.compare(x.doubleValue(), y.doubleValue());
            }
            return left.compareTo(right);
        }
        if (a instanceof String && b instanceof String) {
            return ((String) a).compareTo((String) b);
        }
        if (a instanceof Boolean && b instanceof Boolean) {
            return Boolean.compare((Boolean) a, (Boolean) b);
        }
        return null;
    }

    /**
     * 值的文本形式，用于模糊匹配和长度限制
     */
    public static String text(Object value) {
        if (value instanceof Number) {
            BigDecimal decimal = toBigDecimal((Number) value);
            if (decimal != null && !(value instanceof Double) && !(value instanceof Float)) {
                return decimal.toPlainString();
            }
        }
        return String.valueOf(value);
    }

    /**
     * 持久化索引时使用的字符串键
     */
    public static String stringKey(Object value) {
        Object normalized = normalize(value);
        if (normalized instanceof BigDecimal) {
            return ((BigDecimal) normalized).toPlainString();
        }
        return String.valueOf(normalized);
    }

    private static boolean isSupportedNumber(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof Double || value instanceof Float
                || value instanceof BigInteger || value instanceof BigDecimal;
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof BigInteger) {
            return new BigDecimal((BigInteger) number);
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return number instanceof Float ? new BigDecimal(number.toString()) : BigDecimal.valueOf(d);
        }
        return BigDecimal.valueOf(number.longValue());
    }
}
