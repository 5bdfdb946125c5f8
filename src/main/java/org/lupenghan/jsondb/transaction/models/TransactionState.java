package org.lupenghan.jsondb.transaction.models;

/**
 * 事务状态：IDLE -> ACTIVE -> (COMMITTING | ROLLING_BACK) -> IDLE
 */
public enum TransactionState {
    IDLE,
    ACTIVE,
    COMMITTING,
    ROLLING_BACK
}
