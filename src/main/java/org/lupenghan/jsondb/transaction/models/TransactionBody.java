package org.lupenghan.jsondb.transaction.models;

/**
 * 事务体，在其中调用数据库的各项操作
 */
@FunctionalInterface
public interface TransactionBody {
    void run() throws Exception;
}
