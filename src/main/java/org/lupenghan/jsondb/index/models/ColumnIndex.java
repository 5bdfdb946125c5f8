package org.lupenghan.jsondb.index.models;

import lombok.Getter;
import org.lupenghan.jsondb.common.utils.Values;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 单列索引：字段值 -> 记录位置（从 0 开始的数组下标，不是 _id）
 */
public class ColumnIndex {
    @Getter
    private final String column;

    // 键为归一化后的字段值，位置列表保持升序
    private final Map<Object, List<Integer>> entries = new HashMap<>();

    public ColumnIndex(String column) {
        this.column = column;
    }

    public void add(Object value, int position) {
        entries.computeIfAbsent(Values.normalize(value), k -> new ArrayList<>()).add(position);
    }

    public List<Integer> positions(Object value) {
        List<Integer> positions = entries.get(Values.normalize(value));
        return positions == null ? Collections.emptyList() : Collections.unmodifiableList(positions);
    }

    public void clear() {
        entries.clear();
    }

    public ColumnIndex copy() {
        ColumnIndex copy = new ColumnIndex(column);
        entries.forEach((k, v) -> copy.entries.put(k, new ArrayList<>(v)));
        return copy;
    }

    /**
     * 持久化形式：字符串化的值 -> 位置数组
     */
    public Map<String, List<Integer>> toPersistedForm() {
        Map<String, List<Integer>> persisted = new TreeMap<>();
        entries.forEach((value, positions) ->
                persisted.computeIfAbsent(Values.stringKey(value), k -> new ArrayList<>()).addAll(positions));
        persisted.values().forEach(Collections::sort);
        return persisted;
    }
}
