package org.lupenghan.jsondb.common;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.function.Supplier;

/**
 * 操作结果：成功时携带返回值，失败时携带错误类型和消息
 * @param <T> 返回值类型
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DbResult<T> {
    private final T value;
    private final ErrorKind errorKind;
    private final String message;

    public static <T> DbResult<T> success(T value) {
        return new DbResult<>(value, null, null);
    }

    public static <T> DbResult<T> failure(ErrorKind kind, String message) {
        return new DbResult<>(null, kind, message);
    }

    /**
     * 执行操作并把 {@link DbException} 转换为失败结果，其他异常照常抛出
     */
    public static <T> DbResult<T> of(Supplier<T> operation) {
        try {
            return success(operation.get());
        } catch (DbException e) {
            return failure(e.getKind(), e.getMessage());
        }
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    /**
     * 取出返回值，失败结果重新抛出对应的异常
     */
    public T orThrow() {
        if (!isSuccess()) {
            throw new DbException(errorKind, message);
        }
        return value;
    }

    @Override
    public String toString() {
        return isSuccess() ? "OK(" + value + ")" : "[" + errorKind.getCode() + "] " + message;
    }
}
