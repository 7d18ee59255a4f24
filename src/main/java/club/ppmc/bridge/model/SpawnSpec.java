/**
 * SpawnSpec.java
 *
 * 描述如何启动一个工具服务器进程的不可变对象。
 * 启动时由 SpawnRegistry 构建一次，所有连接到同一名称的会话共享同一个实例。
 */
package club.ppmc.bridge.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * @param name 注册表中的键，也是 {@code /mcp/<name>} 的最后一段。
 * @param command 可执行文件路径或名称。
 * @param args 有序参数列表（永不为 null）。
 * @param env 环境变量覆盖项（永不为 null）。
 */
public record SpawnSpec(String name, String command, List<String> args, Map<String, String> env) {

    public SpawnSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(command, "command");
        args = args == null ? List.of() : List.copyOf(args);
        env = env == null ? Map.of() : Map.copyOf(env);
    }

    public static SpawnSpec of(String name, ServerConfig config) {
        return new SpawnSpec(name, config.command(), config.args(), config.env());
    }

    /** 交给 ProcessBuilder 的完整命令行：命令在前，参数在后。 */
    public List<String> commandLine() {
        List<String> commandLine = new ArrayList<>(args.size() + 1);
        commandLine.add(command);
        commandLine.addAll(args);
        return commandLine;
    }

    public ServerConfig toConfig() {
        return new ServerConfig(command, args, env);
    }

    @Override
    public String toString() {
        return String.join(" ", commandLine());
    }
}
