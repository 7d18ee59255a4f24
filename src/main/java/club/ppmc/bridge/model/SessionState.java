/**
 * SessionState.java
 *
 * 桥接会话的生命周期状态。合法的迁移路径只有
 * CONNECTING -> ACTIVE -> CLOSING -> CLOSED 以及 CONNECTING -> CLOSED（进程启动失败）。
 */
package club.ppmc.bridge.model;

public enum SessionState {
    /** 连接已接受，进程尚未启动。 */
    CONNECTING,
    ACTIVE,
    /** 正在清理，第一个触发者已胜出。 */
    CLOSING,
    CLOSED
}
