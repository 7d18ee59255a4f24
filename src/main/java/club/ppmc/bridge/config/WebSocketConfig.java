/**
 * WebSocketConfig.java
 *
 * 注册原生 WebSocket 端点 {@code /mcp/<name>}。
 * 桥接只转发纯文本帧，所以不使用 STOMP 消息代理，也没有 SockJS 降级，
 * 编排端用普通的 WebSocket 客户端即可连接。路由校验在升级前由 RouteHandshakeInterceptor 完成。
 */
package club.ppmc.bridge.config;

import club.ppmc.bridge.controller.McpBridgeWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final McpBridgeWebSocketHandler bridgeHandler;
    private final RouteHandshakeInterceptor routeHandshakeInterceptor;
    private final String[] allowedOriginPatterns;

    public WebSocketConfig(
            McpBridgeWebSocketHandler bridgeHandler,
            RouteHandshakeInterceptor routeHandshakeInterceptor,
            @Value("${bridge.websocket.allowed-origins:*}") String[] allowedOriginPatterns) {
        this.bridgeHandler = bridgeHandler;
        this.routeHandshakeInterceptor = routeHandshakeInterceptor;
        this.allowedOriginPatterns = allowedOriginPatterns;
    }

    /**
     * 注册桥接处理器。
     *
     * <p><b>设计思路</b>:
     * 1. <b>映射</b>: {@code /mcp/**} 下的所有路径都会先到达拦截器，
     *    不是 {@code /mcp/<已知名称>} 的请求在拦截器中得到 404。
     * 2. <b>来源</b>: 使用 {@code setAllowedOriginPatterns}，默认允许任意来源，可通过配置收紧。
     * </p>
     */
    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(bridgeHandler, "/mcp/**")
                .addInterceptors(routeHandshakeInterceptor)
                .setAllowedOriginPatterns(allowedOriginPatterns);
    }

    /**
     * 容器级限制。JSON-RPC 结果（文件内容、工具列表）很容易超过容器默认的 8 KiB 消息缓冲区。
     */
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer(
            @Value("${bridge.websocket.max-text-message-size:10485760}") int maxTextMessageSize) {
        var container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(maxTextMessageSize);
        container.setMaxBinaryMessageBufferSize(maxTextMessageSize);
        return container;
    }
}
