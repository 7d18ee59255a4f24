/**
 * RouteHandshakeInterceptor.java
 *
 * 在每个 {@code /mcp/**} 请求的 WebSocket 握手之前执行。
 * 路径无法解析到已注册服务器的请求直接返回 404 Not Found 并中止升级，不会建立通道，也不会启动进程。
 * 解析成功时，把 SpawnSpec 放入握手属性，供 McpBridgeWebSocketHandler 使用。
 */
package club.ppmc.bridge.config;

import club.ppmc.bridge.model.SpawnSpec;
import club.ppmc.bridge.service.RouteResolver;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

@Component
@Slf4j
public class RouteHandshakeInterceptor implements HandshakeInterceptor {

    public static final String SPAWN_SPEC_ATTRIBUTE = "bridge.spawnSpec";

    private final RouteResolver routeResolver;

    public RouteHandshakeInterceptor(RouteResolver routeResolver) {
        this.routeResolver = routeResolver;
    }

    @Override
    public boolean beforeHandshake(
            ServerHttpRequest request,
            ServerHttpResponse response,
            WebSocketHandler wsHandler,
            Map<String, Object> attributes) {
        // 按原始路径匹配，百分号编码的名称不会被解码后命中
        String path = request.getURI().getRawPath();
        Optional<SpawnSpec> spec = routeResolver.resolve(path);
        if (spec.isEmpty()) {
            routeResolver.extractName(path).ifPresentOrElse(
                    name -> log.info("Connection rejected: Unknown server '{}'", name),
                    () -> log.info("Connection rejected: Invalid path '{}'", path));
            response.setStatusCode(HttpStatus.NOT_FOUND);
            return false;
        }
        attributes.put(SPAWN_SPEC_ATTRIBUTE, spec.get());
        return true;
    }

    @Override
    public void afterHandshake(
            ServerHttpRequest request,
            ServerHttpResponse response,
            WebSocketHandler wsHandler,
            Exception exception) {
        if (exception != null) {
            log.warn("WebSocket handshake for {} failed: {}", request.getURI().getPath(), exception.getMessage());
        }
    }
}
