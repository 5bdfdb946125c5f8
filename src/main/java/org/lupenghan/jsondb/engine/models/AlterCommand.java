package org.lupenghan.jsondb.engine.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lupenghan.jsondb.schema.models.FieldConstraint;

/**
 * ALTER TABLE 参数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlterCommand {
    private AlterAction action;
    private String columnName;
    private FieldConstraint columnDef;   // ADD_COLUMN / MODIFY_COLUMN 使用
    private Object defaultValue;         // ADD_COLUMN 时补给已有记录

    public static AlterCommand addColumn(String columnName, FieldConstraint columnDef, Object defaultValue) {
        return new AlterCommand(AlterAction.ADD_COLUMN, columnName, columnDef, defaultValue);
    }

    public static AlterCommand dropColumn(String columnName) {
        return new AlterCommand(AlterAction.DROP_COLUMN, columnName, null, null);
    }

    public static AlterCommand modifyColumn(String columnName, FieldConstraint columnDef) {
        return new AlterCommand(AlterAction.MODIFY_COLUMN, columnName, columnDef, null);
    }
}
