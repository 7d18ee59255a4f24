/**
 * BridgeController.java
 *
 * 与 WebSocket 桥接并列的 HTTP 发现端点。只公开只读的服务器注册表，不暴露任何会话数据。
 */
package club.ppmc.bridge.controller;

import club.ppmc.bridge.model.ServerConfig;
import club.ppmc.bridge.model.SpawnSpec;
import club.ppmc.bridge.service.SpawnRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class BridgeController {

    private final SpawnRegistry spawnRegistry;

    public BridgeController(SpawnRegistry spawnRegistry) {
        this.spawnRegistry = spawnRegistry;
    }

    /** 存活状态，以及可以通过 {@code /mcp/<name>} 连接的名称。 */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("servers", spawnRegistry.names());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/servers")
    public ResponseEntity<Map<String, ServerConfig>> servers() {
        Map<String, ServerConfig> body = new LinkedHashMap<>();
        for (SpawnSpec spec : spawnRegistry.specs()) {
            body.put(spec.name(), spec.toConfig());
        }
        return ResponseEntity.ok(body);
    }
}
