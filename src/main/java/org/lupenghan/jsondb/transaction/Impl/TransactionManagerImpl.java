package org.lupenghan.jsondb.transaction.Impl;

import lombok.extern.slf4j.Slf4j;
import org.lupenghan.jsondb.common.DbException;
import org.lupenghan.jsondb.common.ErrorKind;
import org.lupenghan.jsondb.storage.interfaces.PersistenceManager;
import org.lupenghan.jsondb.storage.models.DatabaseState;
import org.lupenghan.jsondb.transaction.interfaces.TransactionManager;
import org.lupenghan.jsondb.transaction.models.Snapshot;
import org.lupenghan.jsondb.transaction.models.TransactionBody;
import org.lupenghan.jsondb.transaction.models.TransactionState;

import java.time.Clock;

@Slf4j
public class TransactionManagerImpl implements TransactionManager {
    private final DatabaseState state;
    private final PersistenceManager persistenceManager;
    private final Clock clock;

    private TransactionState transactionState = TransactionState.IDLE;
    private Snapshot snapshot;

    public TransactionManagerImpl(DatabaseState state, PersistenceManager persistenceManager, Clock clock) {
        this.state = state;
        this.persistenceManager = persistenceManager;
        this.clock = clock;
    }

    @Override
    public void begin() {
        if (transactionState != TransactionState.IDLE) {
            throw DbException.engine("已有活跃事务");
        }
        snapshot = new Snapshot(state.copy(), clock.instant());
        transactionState = TransactionState.ACTIVE;
        log.debug("事务开始，快照包含 {} 个表", snapshot.getState().getTables().size());
    }

    @Override
    public boolean commit() {
        requireActive();
        transactionState = TransactionState.COMMITTING;
        try {
            boolean saved = persistenceManager.save(true);
            log.debug("事务提交，保存结果: {}", saved);
            return saved;
        } finally {
            finish();
        }
    }

    @Override
    public void rollback() {
        requireActive();
        transactionState = TransactionState.ROLLING_BACK;
        try {
            state.replaceWith(snapshot.getState());
            log.debug("事务回滚到 {} 时的快照", snapshot.getTakenAt());
        } finally {
            finish();
        }
    }

    @Override
    public void execute(TransactionBody body) {
        begin();
        try {
            body.run();
        } catch (RuntimeException | Error e) {
            rollback();
            throw e;
        } catch (Exception e) {
            rollback();
            throw new DbException(ErrorKind.ENGINE, "事务执行失败: " + e.getMessage(), e);
        }
        commit();
    }

    @Override
    public TransactionState getState() {
        return transactionState;
    }

    @Override
    public boolean isActive() {
        return transactionState == TransactionState.ACTIVE;
    }

    private void requireActive() {
        if (transactionState != TransactionState.ACTIVE) {
            throw DbException.engine("当前没有活跃事务");
        }
    }

    private void finish() {
        snapshot = null;
        transactionState = TransactionState.IDLE;
    }
}
