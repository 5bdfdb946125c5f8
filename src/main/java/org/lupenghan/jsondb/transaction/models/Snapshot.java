package org.lupenghan.jsondb.transaction.models;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.lupenghan.jsondb.storage.models.DatabaseState;

import java.time.Instant;

/**
 * 事务开始时的完整状态拷贝（表数据、表结构、索引）
 */
@Getter
@AllArgsConstructor
public class Snapshot {
    private final DatabaseState state;
    private final Instant takenAt;
}
