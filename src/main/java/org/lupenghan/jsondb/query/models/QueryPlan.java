package org.lupenghan.jsondb.query.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 查询执行计划
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryPlan {
    public static final String INDEX_SCAN = "index_scan";
    public static final String FULL_SCAN = "full_scan";

    private String table;
    @JsonProperty("scan_type")
    private String scanType;
    @JsonProperty("estimated_rows")
    private int estimatedRows;
    @JsonProperty("indexes_used")
    private List<String> indexesUsed;
    private Map<String, Object> condition;
}
