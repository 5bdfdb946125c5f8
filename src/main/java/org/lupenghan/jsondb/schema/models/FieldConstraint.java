package org.lupenghan.jsondb.schema.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 字段约束定义
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldConstraint {
    private FieldType type;        // 字段类型，为空时不检查类型
    private boolean required;      // 是否必填
    @JsonProperty("max_length")
    private Integer maxLength;     // 文本长度上限（可选）

    public FieldConstraint copy() {
        return new FieldConstraint(type, required, maxLength);
    }
}
