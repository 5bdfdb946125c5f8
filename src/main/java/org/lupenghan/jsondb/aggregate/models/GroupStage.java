package org.lupenghan.jsondb.aggregate.models;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.lupenghan.jsondb.common.utils.Values;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * $group：按字段值分组计数，输出 {_id: 分组键, count: 数量}
 * 字段缺失的记录归入 null 分组，分组顺序为首次出现的顺序
 */
@Getter
@AllArgsConstructor
public class GroupStage implements Stage {
    public static final String ID = "_id";
    public static final String COUNT = "count";

    private final String byField;

    @Override
    public List<Map<String, Object>> apply(List<Map<String, Object>> input) {
        Map<Object, Map<String, Object>> groups = new LinkedHashMap<>();
        for (Map<String, Object> record : input) {
            Object key = record.get(byField);
            Map<String, Object> group = groups.computeIfAbsent(Values.normalize(key), k -> {
                Map<String, Object> created = new LinkedHashMap<>();
                created.put(ID, Values.deepCopy(key));
                created.put(COUNT, 0);
                return created;
            });
            group.put(COUNT, (Integer) group.get(COUNT) + 1);
        }
        return new ArrayList<>(groups.values());
    }
}
