package org.lupenghan.jsondb.engine.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 表统计信息：每列的类型、空值数、不同值数
 */
@Data
public class TableAnalysis {
    @JsonProperty("record_count")
    private int recordCount;
    // 列名 -> 首次出现时的值类型
    @JsonProperty("data_types")
    private Map<String, String> dataTypes = new LinkedHashMap<>();
    @JsonProperty("null_counts")
    private Map<String, Integer> nullCounts = new LinkedHashMap<>();
    @JsonProperty("unique_counts")
    private Map<String, Integer> uniqueCounts = new LinkedHashMap<>();
}
