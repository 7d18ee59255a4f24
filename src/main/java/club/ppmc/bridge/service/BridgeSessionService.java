/**
 * BridgeSessionService.java
 *
 * 管理所有存活的 BridgeSession，以 WebSocket 会话 ID 为键。
 * 路由成功的连接建立时打开会话，把收到的消息交给对应进程，
 * 并在连接断开、空闲超时（可选）以及应用关闭时清理会话。单个会话的故障不会影响其他会话。
 */
package club.ppmc.bridge.service;

import club.ppmc.bridge.exception.SpawnFailureException;
import club.ppmc.bridge.model.SpawnSpec;
import club.ppmc.bridge.util.CloseReasons;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

@Service
@Slf4j
public class BridgeSessionService {

    private final ProcessLauncher processLauncher;
    private final ExecutorService executorService = Executors.newCachedThreadPool();
    private final ScheduledExecutorService idleReaper = Executors.newSingleThreadScheduledExecutor();
    private final Map<String, BridgeSession> sessions = new ConcurrentHashMap<>();

    private final Duration idleTimeout;
    private final Duration terminationGrace;
    private final int sendTimeLimitMs;
    private final int sendBufferSizeLimit;

    public BridgeSessionService(
            ProcessLauncher processLauncher,
            @Value("${bridge.session.idle-timeout-ms:0}") long idleTimeoutMs,
            @Value("${bridge.process.termination-grace-ms:2000}") long terminationGraceMs,
            @Value("${bridge.websocket.send-time-limit-ms:2147483647}") int sendTimeLimitMs,
            @Value("${bridge.websocket.send-buffer-size-limit:2147483647}") int sendBufferSizeLimit) {
        this.processLauncher = processLauncher;
        this.idleTimeout = Duration.ofMillis(Math.max(0, idleTimeoutMs));
        this.terminationGrace = Duration.ofMillis(Math.max(0, terminationGraceMs));
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.sendBufferSizeLimit = sendBufferSizeLimit;
    }

    @PostConstruct
    public void init() {
        if (idleTimeout.isZero()) {
            log.info("Idle session timeout disabled");
            return;
        }
        long period = Math.max(100, Math.min(1000, idleTimeout.toMillis() / 2));
        idleReaper.scheduleAtFixedRate(this::reapIdleSessions, period, period, TimeUnit.MILLISECONDS);
        log.info("Idle sessions will be closed after {} ms", idleTimeout.toMillis());
    }

    /**
     * 为 {@code spec} 启动进程并绑定到 {@code connection}。
     * 启动失败时以 1011 关闭连接，关闭原因中带有失败原因。
     *
     * @return 活动会话；启动失败时为空。
     */
    public Optional<BridgeSession> open(WebSocketSession connection, SpawnSpec spec) {
        var outbound = new ConcurrentWebSocketSessionDecorator(connection, sendTimeLimitMs, sendBufferSizeLimit);
        var session = new BridgeSession(spec, outbound, terminationGrace);

        // 在 CONNECTING 阶段就注册，与启动过程竞争的断开事件也能找到该会话
        sessions.put(connection.getId(), session);
        session.closeFuture().whenComplete((status, ex) -> sessions.remove(connection.getId(), session));

        try {
            session.start(processLauncher, executorService);
        } catch (SpawnFailureException e) {
            log.error("[{}] Spawn error: {}", spec.name(), e.getMessage(), e.getCause());
            closeConnection(outbound, CloseReasons.spawnFailed(e.getMessage()));
            return Optional.empty();
        }
        return Optional.of(session);
    }

    public void receive(String connectionId, String payload) {
        BridgeSession session = sessions.get(connectionId);
        if (session == null) {
            log.warn("No active bridge session for connection {}. Ignoring message.", connectionId);
            return;
        }
        session.sendToProcess(payload);
    }

    /** 可重复调用。 */
    public void close(String connectionId, CloseStatus status) {
        BridgeSession session = sessions.get(connectionId);
        if (session != null) {
            session.close(status);
        }
    }

    public Optional<BridgeSession> getSession(String connectionId) {
        return Optional.ofNullable(sessions.get(connectionId));
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    void reapIdleSessions() {
        for (BridgeSession session : List.copyOf(sessions.values())) {
            if (session.idleTime().compareTo(idleTimeout) >= 0) {
                log.info("[{}] Session {} idle for {} ms, closing", session.name(), session.id(),
                        session.idleTime().toMillis());
                session.close(CloseReasons.idleTimeout());
            }
        }
    }

    private void closeConnection(WebSocketSession connection, CloseStatus status) {
        if (!connection.isOpen()) {
            return;
        }
        try {
            connection.close(status);
        } catch (IOException e) {
            log.warn("Error closing connection {}: {}", connection.getId(), e.getMessage());
        }
    }

    /**
     * 应用关闭时清理所有会话。
     *
     * <p><b>设计思路</b>:
     * 会话自身的强制终止依赖 {@code CompletableFuture.orTimeout} 的守护线程计时器，
     * JVM 退出时它来不及触发，忽略 SIGTERM 的进程就会成为孤儿进程。
     * 因此这里先记录每个会话的进程树，关闭会话（发送 SIGTERM）后同步等待至多一个宽限期，
     * 再对仍然存活的进程执行 destroyForcibly。
     * </p>
     */
    @PreDestroy
    public void destroy() {
        List<BridgeSession> open = List.copyOf(sessions.values());
        log.info("Shutting down BridgeSessionService. Closing {} active session(s).", open.size());

        List<ProcessHandle> processTrees = new ArrayList<>();
        open.forEach(session -> processTrees.addAll(session.liveProcessTree()));
        open.forEach(session -> session.close(CloseReasons.shuttingDown()));
        idleReaper.shutdownNow();
        executorService.shutdownNow();

        awaitOrKill(processTrees);
    }

    private void awaitOrKill(List<ProcessHandle> processTrees) {
        if (processTrees.isEmpty()) {
            return;
        }
        CompletableFuture<?>[] exits = processTrees.stream()
                .map(ProcessHandle::onExit)
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(exits).get(terminationGrace.toMillis(), TimeUnit.MILLISECONDS);
            return;
        } catch (TimeoutException e) {
            log.warn("Processes still running {} ms after shutdown signal, killing them", terminationGrace.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for processes to exit, killing them");
        } catch (ExecutionException e) {
            log.warn("Error while waiting for processes to exit: {}", e.getMessage());
        }

        for (ProcessHandle handle : processTrees) {
            if (handle.isAlive()) {
                log.warn("Force killing PID {}", handle.pid());
                handle.destroyForcibly();
            }
        }
    }
}
