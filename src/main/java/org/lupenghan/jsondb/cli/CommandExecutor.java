package org.lupenghan.jsondb.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.lupenghan.jsondb.cli.CommandParser.Command;
import org.lupenghan.jsondb.common.DbException;
import org.lupenghan.jsondb.engine.interfaces.Database;
import org.lupenghan.jsondb.schema.models.FieldConstraint;

import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * 把解析后的命令转换为数据库调用
 */
@Slf4j
public class CommandExecutor {
    private static final TypeReference<Map<String, FieldConstraint>> SCHEMA_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> OBJECT_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<Map<String, Object>>> PIPELINE_TYPE = new TypeReference<>() {
    };

    private final Database database;
    private final ObjectMapper mapper = new ObjectMapper();

    public CommandExecutor(Database database) {
        this.database = database;
    }

    public Object execute(Command cmd) {
        String table = cmd.getTableName();
        List<Object> args = cmd.getArguments();
        log.debug("执行命令: {}", cmd.getRaw());
        return switch (cmd.getType()) {
            case TABLES -> database.listTables();
            case CREATE -> database.createTable(table, args.isEmpty() ? null : convert(args.get(0), SCHEMA_TYPE));
            case DROP -> database.dropTable(table);
            case INSERT -> database.insert(table, convert(arg(args, 0, "记录"), OBJECT_TYPE));
            case SELECT -> database.select(table,
                    args.isEmpty() ? null : convert(args.get(0), OBJECT_TYPE),
                    args.size() > 1 ? intArg(args.get(1)) : null,
                    args.size() > 2 ? intArg(args.get(2)) : 0);
            case UPDATE -> database.update(table,
                    convert(arg(args, 0, "条件"), OBJECT_TYPE),
                    convert(arg(args, 1, "新值"), OBJECT_TYPE));
            case DELETE -> database.delete(table, convert(arg(args, 0, "条件"), OBJECT_TYPE));
            case COUNT -> database.count(table, args.isEmpty() ? null : convert(args.get(0), OBJECT_TYPE));
            case INDEX -> database.createIndex(table, String.valueOf(arg(args, 0, "列名")));
            case AGGREGATE -> database.aggregate(table, convert(arg(args, 0, "聚合管道"), PIPELINE_TYPE));
            case INFO -> table == null ? database.getDatabaseInfo() : database.getTableInfo(table);
            case BACKUP -> cmd.getPath() == null ? database.backup() : database.backup(Paths.get(cmd.getPath()));
            case RESTORE -> {
                if (cmd.getPath() == null) {
                    throw DbException.validation("restore 需要备份文件路径");
                }
                yield database.restore(Paths.get(cmd.getPath()));
            }
            case SQL -> database.executeQuery(cmd.getQuery());
            case EXIT, UNKNOWN -> throw DbException.validation("无法解析的命令: " + cmd.getRaw());
        };
    }

    private static Object arg(List<Object> args, int index, String name) {
        if (args.size() <= index) {
            throw DbException.validation("缺少参数: " + name);
        }
        return args.get(index);
    }

    private static Integer intArg(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        throw DbException.validation("参数必须是整数: " + value);
    }

    private <T> T convert(Object value, TypeReference<T> type) {
        try {
            return mapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw DbException.validation("参数格式错误: " + e.getMessage());
        }
    }
}
