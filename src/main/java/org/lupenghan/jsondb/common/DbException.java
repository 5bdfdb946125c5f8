package org.lupenghan.jsondb.common;

import lombok.Getter;

import java.time.LocalDateTime;

/**
 * 引擎统一异常，通过 {@link ErrorKind} 区分错误类型
 */
@Getter
public class DbException extends RuntimeException {

    private final ErrorKind kind;

    private final LocalDateTime timestamp;

    public DbException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
        this.timestamp = LocalDateTime.now();
    }

    public DbException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.timestamp = LocalDateTime.now();
    }

    public static DbException validation(String message) {
        return new DbException(ErrorKind.VALIDATION, message);
    }

    public static DbException tableNotFound(String tableName) {
        return new DbException(ErrorKind.TABLE_NOT_FOUND, "表 '" + tableName + "' 不存在");
    }

    public static DbException engine(String message) {
        return new DbException(ErrorKind.ENGINE, message);
    }

    @Override
    public String toString() {
        return "[" + kind.getCode() + "] " + getMessage();
    }
}
