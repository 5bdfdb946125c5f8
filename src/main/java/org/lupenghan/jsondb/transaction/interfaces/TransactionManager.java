package org.lupenghan.jsondb.transaction.interfaces;

import org.lupenghan.jsondb.transaction.models.TransactionBody;
import org.lupenghan.jsondb.transaction.models.TransactionState;

public interface TransactionManager {
    // 开始事务：已有活跃事务时抛出 ENGINE 错误
    void begin();

    /**
     * 提交事务并强制保存一次
     * @return 保存是否成功
     */
    boolean commit();

    // 用快照整体替换当前状态
    void rollback();

    /**
     * 在一个事务中执行 body：正常结束则提交，抛出异常则回滚后原样抛出
     * （受检异常包装为 ENGINE 类型的 DbException）
     */
    void execute(TransactionBody body);

    TransactionState getState();

    // 事务体执行期间（ACTIVE）返回 true，此时数据库不写文件
    boolean isActive();
}
