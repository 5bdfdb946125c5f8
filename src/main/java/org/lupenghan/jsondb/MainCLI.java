package org.lupenghan.jsondb;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.lupenghan.jsondb.cli.CommandExecutor;
import org.lupenghan.jsondb.cli.CommandParser;
import org.lupenghan.jsondb.cli.CommandParser.Command;
import org.lupenghan.jsondb.cli.CommandParser.CommandType;
import org.lupenghan.jsondb.common.DbConfig;
import org.lupenghan.jsondb.common.DbResult;
import org.lupenghan.jsondb.engine.interfaces.Database;

import java.nio.file.Paths;
import java.util.Scanner;

public class MainCLI {

    private final CommandExecutor executor;
    private final ObjectMapper mapper = new ObjectMapper();

    public MainCLI(Database database) {
        this.executor = new CommandExecutor(database);
    }

    public void run() {
        Scanner scanner = new Scanner(System.in);
        System.out.println("欢迎使用 jsondb 文档数据库。输入命令或 exit 退出。");

        while (true) {
            System.out.print("\n> ");
            if (!scanner.hasNextLine()) break;
            String line = scanner.nextLine().trim();
            if (line.isEmpty()) continue;

            DbResult<Command> parsed = DbResult.of(() -> CommandParser.parse(line));
            if (!parsed.isSuccess()) {
                System.err.println("⚠️ " + parsed);
                continue;
            }
            Command cmd = parsed.getValue();
            if (cmd.getType() == CommandType.EXIT) break;
            if (cmd.getType() == CommandType.UNKNOWN) {
                System.out.println("❌ 无法解析的命令: " + line);
                continue;
            }

            DbResult<Object> result = DbResult.of(() -> executor.execute(cmd));
            if (result.isSuccess()) {
                System.out.println(render(result.getValue()));
            } else {
                System.err.println("⚠️ 执行出错：" + result);
            }
        }

        System.out.println("👋 再见！");
    }

    private String render(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    public static void main(String[] args) {
        DbConfig config = DbConfig.load();
        if (args.length > 0) {
            config = config.toBuilder().path(Paths.get(args[0])).build();
        }
        try (Database database = Database.open(config)) {
            new MainCLI(database).run();
        }
    }
}
