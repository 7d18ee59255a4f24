/**
 * McpBridgeApplication.java
 *
 * MCP 桥接服务的 Spring Boot 启动类。
 * 通过 {@code /mcp/<name>} 上的 WebSocket 暴露本地启动的 stdio MCP 服务器，
 * 并在 /health 与 /servers 上公布已配置的服务器。
 */
package club.ppmc.bridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class McpBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(McpBridgeApplication.class, args);
    }
}
