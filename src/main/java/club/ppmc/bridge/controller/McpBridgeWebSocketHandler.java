/**
 * McpBridgeWebSocketHandler.java
 *
 * {@code /mcp/<name>} 背后的 WebSocket 处理器。
 * 它只负责把容器事件翻译成对 BridgeSessionService 的调用：连接建立时打开会话，
 * 文本消息交给进程，连接关闭或出错时清理会话。
 * 二进制帧由 TextWebSocketHandler 以 1003 拒绝。
 */
package club.ppmc.bridge.controller;

import club.ppmc.bridge.config.RouteHandshakeInterceptor;
import club.ppmc.bridge.model.SpawnSpec;
import club.ppmc.bridge.service.BridgeSessionService;
import club.ppmc.bridge.service.RouteResolver;
import club.ppmc.bridge.util.CloseReasons;
import java.net.URI;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
@Slf4j
public class McpBridgeWebSocketHandler extends TextWebSocketHandler {

    private final BridgeSessionService bridgeSessionService;
    private final RouteResolver routeResolver;

    public McpBridgeWebSocketHandler(BridgeSessionService bridgeSessionService, RouteResolver routeResolver) {
        this.bridgeSessionService = bridgeSessionService;
        this.routeResolver = routeResolver;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        SpawnSpec spec = resolveSpec(session);
        if (spec == null) {
            log.warn("Connection {} reached the bridge without a resolvable server, closing", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION.withReason("Unknown server"));
            return;
        }
        log.info("[{}] Client connected ({})", spec.name(), session.getId());
        bridgeSessionService.open(session, spec);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        bridgeSessionService.receive(session.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("[{}] WebSocket error on {}: {}", serverName(session), session.getId(), exception.getMessage());
        bridgeSessionService.close(session.getId(), CloseReasons.serverError("Connection error"));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("[{}] Client disconnected ({}): {}", serverName(session), session.getId(), status);
        bridgeSessionService.close(session.getId(), status);
    }

    private SpawnSpec resolveSpec(WebSocketSession session) {
        Object attribute = session.getAttributes().get(RouteHandshakeInterceptor.SPAWN_SPEC_ATTRIBUTE);
        if (attribute instanceof SpawnSpec spec) {
            return spec;
        }
        URI uri = session.getUri();
        return uri == null ? null : routeResolver.resolve(uri.getRawPath()).orElse(null);
    }

    private String serverName(WebSocketSession session) {
        SpawnSpec spec = resolveSpec(session);
        return spec == null ? "?" : spec.name();
    }
}
