/**
 * SpawnFailureException.java
 *
 * 当操作系统拒绝启动已配置的工具服务器时（命令不存在、权限不足等），由 ProcessLauncher 抛出。
 * BridgeSessionService 会将其转换为一次异常的 WebSocket 关闭，关闭原因中包含底层错误信息。
 */
package club.ppmc.bridge.exception;

import lombok.Getter;

@Getter
public class SpawnFailureException extends RuntimeException {

    private final String serverName;

    public SpawnFailureException(String serverName, Throwable cause) {
        super("Failed to spawn process: " + cause.getMessage(), cause);
        this.serverName = serverName;
    }
}
