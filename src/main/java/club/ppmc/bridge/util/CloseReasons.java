/**
 * CloseReasons.java
 *
 * 构建 WebSocket 关闭状态的工具类。
 * RFC 6455 规定关闭原因最多 123 个 UTF-8 字节，Servlet 容器会拒绝更长的原因，
 * 所以凡是嵌入任意错误信息的关闭原因都要经过这里截断。
 */
package club.ppmc.bridge.util;

import java.nio.charset.StandardCharsets;
import org.springframework.web.socket.CloseStatus;

public final class CloseReasons {

    public static final int MAX_REASON_BYTES = 123;

    public static final String PROCESS_EXITED = "Process exited";
    public static final String IDLE_TIMEOUT = "Idle timeout";
    public static final String SHUTTING_DOWN = "Bridge shutting down";

    private CloseReasons() {}

    public static CloseStatus processExited() {
        return CloseStatus.NORMAL.withReason(PROCESS_EXITED);
    }

    public static CloseStatus spawnFailed(String message) {
        return CloseStatus.SERVER_ERROR.withReason(truncate(message));
    }

    public static CloseStatus serverError(String message) {
        return CloseStatus.SERVER_ERROR.withReason(truncate(message));
    }

    public static CloseStatus idleTimeout() {
        return CloseStatus.NORMAL.withReason(IDLE_TIMEOUT);
    }

    public static CloseStatus shuttingDown() {
        return CloseStatus.GOING_AWAY.withReason(SHUTTING_DOWN);
    }

    /** 截断到 {@link #MAX_REASON_BYTES} 字节，不会拆开一个字符。 */
    public static String truncate(String reason) {
        if (reason == null) {
            return null;
        }
        if (reason.getBytes(StandardCharsets.UTF_8).length <= MAX_REASON_BYTES) {
            return reason;
        }
        var sb = new StringBuilder();
        int bytes = 0;
        for (int i = 0; i < reason.length(); ) {
            int codePoint = reason.codePointAt(i);
            int width = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8).length;
            if (bytes + width > MAX_REASON_BYTES) {
                break;
            }
            sb.appendCodePoint(codePoint);
            bytes += width;
            i += Character.charCount(codePoint);
        }
        return sb.toString();
    }
}
