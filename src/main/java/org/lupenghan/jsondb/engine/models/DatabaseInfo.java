package org.lupenghan.jsondb.engine.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 数据库整体信息
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseInfo {
    @JsonProperty("database_path")
    private String databasePath;
    @JsonProperty("table_count")
    private int tableCount;
    @JsonProperty("total_records")
    private int totalRecords;
    @JsonProperty("total_indexes")
    private int totalIndexes;
    private Map<String, TableInfo> tables;
    @JsonProperty("file_size_bytes")
    private long fileSizeBytes;
}
