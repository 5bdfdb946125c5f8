package org.lupenghan.jsondb.storage.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lupenghan.jsondb.schema.models.FieldConstraint;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 持久化文件的顶层结构
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"version", "created_at", "tables", "schemas", "indexes"})
public class DatabaseFile {
    public static final String CURRENT_VERSION = "1.0";

    private String version;
    @JsonProperty("created_at")
    private String createdAt;
    @Builder.Default
    private Map<String, List<Map<String, Object>>> tables = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Map<String, FieldConstraint>> schemas = new LinkedHashMap<>();
    // 表名 -> 列名 -> 字符串化的值 -> 位置数组
    @Builder.Default
    private Map<String, Map<String, Map<String, List<Integer>>>> indexes = new LinkedHashMap<>();
}
