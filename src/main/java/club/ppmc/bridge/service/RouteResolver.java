/**
 * RouteResolver.java
 *
 * 将升级请求的路径映射到它所请求的 SpawnSpec。
 * 只接受 {@code /mcp/<name>}，且名称仅由字母、数字、下划线或连字符组成；
 * 其他路径或注册表中不存在的名称均解析为空。
 * 路径按原始（未解码）形式匹配，因此 {@code /mcp/ec%68o} 不会被当作 {@code /mcp/echo}。
 */
package club.ppmc.bridge.service;

import club.ppmc.bridge.model.SpawnSpec;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Service;

@Service
public class RouteResolver {

    public static final String PATH_PREFIX = "/mcp/";

    private static final Pattern ROUTE_PATTERN = Pattern.compile("^/mcp/([A-Za-z0-9_-]+)$");

    private final SpawnRegistry registry;

    public RouteResolver(SpawnRegistry registry) {
        this.registry = registry;
    }

    public Optional<SpawnSpec> resolve(String rawPath) {
        return extractName(rawPath).flatMap(registry::find);
    }

    /**
     * 在不查询注册表的情况下提取候选服务器名称。
     *
     * @param rawPath 未经百分号解码的请求路径，不含查询字符串。
     * @return 路径形状正确时返回名称。
     */
    public Optional<String> extractName(String rawPath) {
        if (rawPath == null) {
            return Optional.empty();
        }
        Matcher matcher = ROUTE_PATTERN.matcher(rawPath);
        return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
