package org.lupenghan.jsondb.engine.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lupenghan.jsondb.schema.models.FieldConstraint;

import java.util.List;
import java.util.Map;

/**
 * 表元数据
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableInfo {
    private String name;
    @JsonProperty("record_count")
    private int recordCount;
    private Map<String, FieldConstraint> schema;
    private List<String> indexes;
    @JsonProperty("size_bytes")
    private long sizeBytes;
}
