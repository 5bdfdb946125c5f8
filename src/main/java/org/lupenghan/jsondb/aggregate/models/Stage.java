package org.lupenghan.jsondb.aggregate.models;

import java.util.List;
import java.util.Map;

/**
 * 聚合管道中的一个阶段，输入为上一阶段的输出
 */
public interface Stage {
    List<Map<String, Object>> apply(List<Map<String, Object>> input);
}
