/**
 * BridgeStartupListener.java
 *
 * 内嵌 Web 服务器拿到端口后，打印监听端口以及每个可启动服务器的连接地址。
 */
package club.ppmc.bridge.listener;

import club.ppmc.bridge.model.SpawnSpec;
import club.ppmc.bridge.service.RouteResolver;
import club.ppmc.bridge.service.SpawnRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class BridgeStartupListener {

    private final SpawnRegistry spawnRegistry;

    public BridgeStartupListener(SpawnRegistry spawnRegistry) {
        this.spawnRegistry = spawnRegistry;
    }

    @EventListener
    public void onWebServerInitialized(WebServerInitializedEvent event) {
        int port = event.getWebServer().getPort();
        log.info("MCP Bridge Server listening on port {}", port);
        if (spawnRegistry.isEmpty()) {
            log.warn("No servers configured. Every /mcp/<name> connection will be rejected.");
            return;
        }
        log.info("Available servers:");
        for (SpawnSpec spec : spawnRegistry.specs()) {
            log.info("- {} -> {}", endpoint(port, spec), spec);
        }
    }

    static String endpoint(int port, SpawnSpec spec) {
        return "ws://localhost:" + port + RouteResolver.PATH_PREFIX + spec.name();
    }
}
