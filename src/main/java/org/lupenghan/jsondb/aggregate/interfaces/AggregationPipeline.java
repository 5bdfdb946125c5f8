package org.lupenghan.jsondb.aggregate.interfaces;

import org.lupenghan.jsondb.aggregate.models.Stage;

import java.util.List;
import java.util.Map;

public interface AggregationPipeline {
    /**
     * 解析管道定义，无法识别的阶段被忽略
     * <pre>
     * [{"$match": {"dept": "eng"}}, {"$group": {"_id": "dept"}}]
     * </pre>
     */
    List<Stage> parse(List<Map<String, Object>> pipeline);

    // 按顺序执行各阶段，表不存在时返回空列表
    List<Map<String, Object>> aggregate(String tableName, List<Map<String, Object>> pipeline);
}
