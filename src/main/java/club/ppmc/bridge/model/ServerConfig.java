/**
 * ServerConfig.java
 *
 * servers.json 中单个条目的数据结构：描述如何启动一个 stdio 工具服务器。
 * 由 SpawnRegistry 通过 Jackson 反序列化，并经 Bean Validation 校验后转换为 SpawnSpec。
 * GET /servers 也直接返回此结构。
 */
package club.ppmc.bridge.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;

/**
 * @param command 可执行文件路径或名称，按桥接进程的 PATH 解析。
 * @param args 有序参数列表，文件中可省略，但不能包含 null 元素。
 * @param env 叠加在桥接进程自身环境之上的环境变量，可省略，值不能为 null。
 */
public record ServerConfig(
        @NotBlank(message = "command must not be blank") String command,
        List<@NotNull(message = "args must not contain null values") String> args,
        Map<String, @NotNull(message = "env values must not be null") String> env) {}
