package org.lupenghan.jsondb.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lupenghan.jsondb.common.DbException;
import org.lupenghan.jsondb.common.ErrorKind;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 命令行解析：命令名、表名，后面跟若干个 JSON 参数
 * <pre>
 * insert users {"name": "张三", "age": 25}
 * select users {"age": {"$gte": 18}} 10 0
 * sql SELECT COUNT(*) FROM users
 * </pre>
 */
public class CommandParser {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static Command parse(String line) {
        String text = line == null ? "" : line.trim();
        if (text.isEmpty()) {
            return Command.builder().type(CommandType.UNKNOWN).raw(text).build();
        }
        String[] head = text.split("\\s+", 2);
        CommandType type = CommandType.fromKeyword(head[0]);
        String rest = head.length > 1 ? head[1].trim() : "";
        Command.CommandBuilder builder = Command.builder().type(type).raw(text);

        switch (type) {
            case TABLES, EXIT, UNKNOWN -> {
                return builder.arguments(new ArrayList<>()).build();
            }
            case BACKUP, RESTORE -> {
                return builder.path(rest.isEmpty() ? null : rest).arguments(new ArrayList<>()).build();
            }
            case SQL -> {
                if (rest.isEmpty()) {
                    throw DbException.validation("sql 命令需要查询语句");
                }
                return builder.query(rest).arguments(new ArrayList<>()).build();
            }
            case INFO -> {
                return builder.tableName(rest.isEmpty() ? null : rest).arguments(new ArrayList<>()).build();
            }
            default -> {
                if (rest.isEmpty()) {
                    throw DbException.validation("命令 " + head[0] + " 需要表名");
                }
                String[] tableAndArgs = rest.split("\\s+", 2);
                builder.tableName(tableAndArgs[0]);
                builder.arguments(tableAndArgs.length > 1 ? readJsonValues(tableAndArgs[1]) : new ArrayList<>());
                return builder.build();
            }
        }
    }

    // 依次读取以空白分隔的多个 JSON 值
    private static List<Object> readJsonValues(String text) {
        List<Object> values = new ArrayList<>();
        try (MappingIterator<JsonNode> iterator = MAPPER.readerFor(JsonNode.class).readValues(text)) {
            while (iterator.hasNextValue()) {
                values.add(MAPPER.convertValue(iterator.nextValue(), Object.class));
            }
        } catch (IOException | RuntimeException e) {
            throw new DbException(ErrorKind.VALIDATION, "无法解析 JSON 参数: " + text, e);
        }
        return values;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Command {
        private CommandType type;
        private String raw;
        private String tableName;
        private String path;
        private String query;
        private List<Object> arguments;
    }

    public enum CommandType {
        TABLES,
        CREATE,
        DROP,
        INSERT,
        SELECT,
        UPDATE,
        DELETE,
        COUNT,
        INDEX,
        AGGREGATE,
        INFO,
        BACKUP,
        RESTORE,
        SQL,
        EXIT,
        UNKNOWN;

        public static CommandType fromKeyword(String keyword) {
            String upper = keyword.toUpperCase(Locale.ROOT);
            if (upper.equals("QUIT")) {
                return EXIT;
            }
            for (CommandType type : values()) {
                if (type != UNKNOWN && type.name().equals(upper)) {
                    return type;
                }
            }
            return UNKNOWN;
        }
    }
}
