package org.lupenghan.jsondb.aggregate.Impl;

import lombok.extern.slf4j.Slf4j;
import org.lupenghan.jsondb.aggregate.interfaces.AggregationPipeline;
import org.lupenghan.jsondb.aggregate.models.GroupStage;
import org.lupenghan.jsondb.aggregate.models.MatchStage;
import org.lupenghan.jsondb.aggregate.models.Stage;
import org.lupenghan.jsondb.common.DbException;
import org.lupenghan.jsondb.query.models.Condition;
import org.lupenghan.jsondb.storage.models.DatabaseState;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
public class AggregationPipelineImpl implements AggregationPipeline {
    private static final String GROUP = "$group";
    private static final String MATCH = "$match";

    private final DatabaseState state;

    public AggregationPipelineImpl(DatabaseState state) {
        this.state = state;
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<Stage> parse(List<Map<String, Object>> pipeline) {
        List<Stage> stages = new ArrayList<>();
        if (pipeline == null) {
            return stages;
        }
        for (Map<String, Object> definition : pipeline) {
            if (definition == null) {
                continue;
            }
            if (definition.containsKey(GROUP)) {
                Object groupDef = definition.get(GROUP);
                Object field = groupDef instanceof Map ? ((Map<?, ?>) groupDef).get(GroupStage.ID) : null;
                if (!(field instanceof String)) {
                    throw DbException.validation("$group 阶段需要字符串类型的 _id 字段");
                }
                stages.add(new GroupStage((String) field));
            } else if (definition.containsKey(MATCH)) {
                Object matchDef = definition.get(MATCH);
                if (matchDef != null && !(matchDef instanceof Map)) {
                    throw DbException.validation("$match 阶段需要条件对象");
                }
                stages.add(new MatchStage(Condition.parse((Map<String, Object>) matchDef)));
            } else {
                log.debug("忽略无法识别的聚合阶段: {}", definition.keySet());
            }
        }
        return stages;
    }

    @Override
    public List<Map<String, Object>> aggregate(String tableName, List<Map<String, Object>> pipeline) {
        List<Map<String, Object>> records = state.records(tableName);
        if (records == null) {
            return new ArrayList<>();
        }
        List<Stage> stages = parse(pipeline);
        List<Map<String, Object>> working = records;
        for (Stage stage : stages) {
            working = stage.apply(working);
        }
        return new ArrayList<>(working);
    }
}
