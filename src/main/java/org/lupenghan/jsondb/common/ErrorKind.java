package org.lupenghan.jsondb.common;

import lombok.Getter;

/**
 * 引擎错误类型
 */
@Getter
public enum ErrorKind {
    // 记录不满足表结构约束，操作前抛出，状态不变
    VALIDATION("VALIDATION_ERROR"),
    // 操作引用的表不存在
    TABLE_NOT_FOUND("TABLE_NOT_FOUND"),
    // 事务重复开启、缺少条件、记录数超限等
    ENGINE("ENGINE_ERROR"),
    // 文件读写失败
    IO("IO_ERROR");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }
}
