package org.lupenghan.jsondb.engine.models;

import lombok.Data;

/**
 * 批量导入统计
 */
@Data
public class ImportResult {
    private int imported;
    private int skipped;
    private int errors;

    public void countImported() {
        imported++;
    }

    public void countSkipped() {
        skipped++;
    }

    public void countError() {
        errors++;
    }
}
