package org.lupenghan.jsondb.engine.interfaces;

import org.lupenghan.jsondb.common.DbConfig;
import org.lupenghan.jsondb.engine.Impl.DatabaseImpl;
import org.lupenghan.jsondb.engine.models.AlterCommand;
import org.lupenghan.jsondb.engine.models.DatabaseInfo;
import org.lupenghan.jsondb.engine.models.ImportMode;
import org.lupenghan.jsondb.engine.models.ImportResult;
import org.lupenghan.jsondb.engine.models.TableAnalysis;
import org.lupenghan.jsondb.engine.models.TableInfo;
import org.lupenghan.jsondb.query.models.QueryPlan;
import org.lupenghan.jsondb.schema.models.FieldConstraint;
import org.lupenghan.jsondb.transaction.models.TransactionBody;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 文档数据库对外操作集合
 * <p>
 * 实例不是线程安全的，多个线程访问同一实例时需要调用方自行串行化。
 * 错误统一以 {@link org.lupenghan.jsondb.common.DbException} 抛出，
 * 通过 {@link org.lupenghan.jsondb.common.ErrorKind} 区分类型；文件读写失败只返回 false。
 */
public interface Database extends AutoCloseable {

    static Database open(DbConfig config) {
        return new DatabaseImpl(config);
    }

    // ---------------- 表管理 ----------------

    boolean createTable(String tableName);

    /**
     * 创建表
     * @param schema 字段约束，可以为 null（不做校验）
     * @return 表已存在返回 false
     */
    boolean createTable(String tableName, Map<String, FieldConstraint> schema);

    // 同时删除表结构和索引，表不存在返回 false
    boolean dropTable(String tableName);

    boolean renameTable(String oldName, String newName);

    // 清空记录，保留表结构和索引定义
    boolean truncateTable(String tableName);

    boolean alterTable(String tableName, AlterCommand command);

    List<String> listTables();

    Map<String, FieldConstraint> getSchema(String tableName);

    boolean setSchema(String tableName, Map<String, FieldConstraint> schema);

    TableInfo getTableInfo(String tableName);

    TableAnalysis analyzeTable(String tableName);

    /**
     * 重建索引，并把 _id 按当前顺序重新编号为 1..N。
     * 外部保存的旧 _id 会失效。
     */
    boolean optimizeTable(String tableName);

    boolean vacuum();

    DatabaseInfo getDatabaseInfo();

    // ---------------- 记录操作 ----------------

    /**
     * 插入记录，自动添加 _id 和 _created_at
     * @return 实际保存的记录副本
     */
    Map<String, Object> insert(String tableName, Map<String, ?> record);

    List<Map<String, Object>> select(String tableName);

    List<Map<String, Object>> select(String tableName, Map<String, ?> condition);

    /**
     * 条件查询
     * @param condition 查询条件，null 表示全部
     * @param limit 为 null 或小于等于 0 时不限制
     * @param offset 跳过的记录数
     * @return 记录副本，保持表内顺序
     */
    List<Map<String, Object>> select(String tableName, Map<String, ?> condition, Integer limit, int offset);

    // 条件不能为空；所有匹配记录先全部校验通过才会写入
    int update(String tableName, Map<String, ?> condition, Map<String, ?> values);

    int delete(String tableName, Map<String, ?> condition);

    int count(String tableName);

    int count(String tableName, Map<String, ?> condition);

    ImportResult importData(String tableName, List<Map<String, Object>> records, ImportMode mode);

    String exportData(String tableName, Map<String, ?> condition);

    // ---------------- 索引 ----------------

    boolean createIndex(String tableName, String column);

    boolean dropIndex(String tableName, String column);

    List<String> listIndexes(String tableName);

    QueryPlan explainQuery(String tableName, Map<String, ?> condition);

    // ---------------- 聚合 ----------------

    List<Map<String, Object>> aggregate(String tableName, List<Map<String, Object>> pipeline);

    /**
     * 简化的类 SQL 查询，只支持：
     * <pre>
     * SELECT COUNT(*) FROM users    返回记录数
     * SHOW TABLES                   返回表名列表
     * </pre>
     * 其他语句抛出 ENGINE 错误
     */
    Object executeQuery(String query);

    // ---------------- 持久化 ----------------

    // 受保存间隔限制的保存
    boolean save();

    // 立即写入文件
    boolean flush();

    boolean backup();

    boolean backup(Path target);

    boolean restore(Path source);

    // ---------------- 事务 ----------------

    void transaction(TransactionBody body);

    void begin();

    boolean commit();

    void rollback();

    boolean isTransactionActive();

    DbConfig getConfig();

    @Override
    void close();
}
