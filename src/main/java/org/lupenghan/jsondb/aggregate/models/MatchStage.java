package org.lupenghan.jsondb.aggregate.models;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.lupenghan.jsondb.query.models.Condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * $match：按条件过滤
 */
@Getter
@AllArgsConstructor
public class MatchStage implements Stage {
    private final Condition condition;

    @Override
    public List<Map<String, Object>> apply(List<Map<String, Object>> input) {
        List<Map<String, Object>> output = new ArrayList<>();
        for (Map<String, Object> record : input) {
            if (condition.test(record)) {
                output.add(record);
            }
        }
        return output;
    }
}
