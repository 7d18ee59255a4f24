/**
 * BridgeSession.java
 *
 * 一个 WebSocket 连接与为其启动的工具服务器进程之间的配对。
 * 会话独占该进程：通过 LineFramer 将 stdout 转发给连接，将 stderr 写入日志，
 * 把收到的消息写入 stdin，并在任意一端先结束时，对两端只执行一次清理。
 *
 * <p><b>设计思路</b>:
 * 1. <b>状态机</b>: CONNECTING -> ACTIVE（启动成功），CONNECTING -> CLOSED（启动失败），
 *    ACTIVE -> CLOSING（第一个终止触发），CLOSING -> CLOSED（进程已终止、连接已关闭）。
 * 2. <b>幂等关闭</b>: 所有迁移都通过 {@link #state} 上的 CAS 完成，
 *    {@link #close(CloseStatus)} 可以被任意线程调用任意次数。
 * 3. <b>退出顺序</b>: 进程退出与 stdout 读取完毕两个 Future 组合之后才关闭连接，
 *    保证进程退出前写出的内容全部送达客户端。
 * </p>
 */
package club.ppmc.bridge.service;

import club.ppmc.bridge.exception.SpawnFailureException;
import club.ppmc.bridge.model.SessionState;
import club.ppmc.bridge.model.SpawnSpec;
import club.ppmc.bridge.util.CloseReasons;
import club.ppmc.bridge.util.LineFramer;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

@Slf4j
public class BridgeSession {

    private static final int READ_BUFFER_SIZE = 8192;

    private final SpawnSpec spec;
    private final WebSocketSession connection;
    private final Duration terminationGrace;
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTING);
    private final CompletableFuture<CloseStatus> closeFuture = new CompletableFuture<>();
    private final Object stdinLock = new Object();

    // 只有 stdout 读取线程访问
    private final LineFramer framer = new LineFramer();

    private volatile Process process;
    private volatile BufferedWriter stdin;
    private volatile long lastActivityNanos = System.nanoTime();

    public BridgeSession(SpawnSpec spec, WebSocketSession connection, Duration terminationGrace) {
        this.spec = spec;
        this.connection = connection;
        this.terminationGrace = terminationGrace;
    }

    /**
     * 启动进程并开始双向转发。
     *
     * @param launcher 负责启动操作系统进程。
     * @param executor 运行 stdout 与 stderr 读取任务的线程池。
     * @throws SpawnFailureException 进程无法启动时抛出，此时会话已处于 CLOSED。
     */
    public void start(ProcessLauncher launcher, ExecutorService executor) {
        Process started;
        try {
            started = launcher.launch(spec);
        } catch (SpawnFailureException e) {
            state.set(SessionState.CLOSED);
            closeFuture.complete(CloseReasons.spawnFailed(e.getMessage()));
            throw e;
        }

        this.process = started;
        this.stdin = new BufferedWriter(new OutputStreamWriter(started.getOutputStream(), StandardCharsets.UTF_8));

        if (!state.compareAndSet(SessionState.CONNECTING, SessionState.ACTIVE)) {
            // 进程启动期间连接已断开，close() 执行时还没有进程可终止
            log.info("[{}] Connection {} closed during spawn, terminating PID {}", name(), id(), started.pid());
            terminateProcess();
            closeStdin();
            return;
        }

        CompletableFuture<Void> stdoutDrained;
        try {
            stdoutDrained = CompletableFuture.runAsync(this::drainStdout, executor);
            CompletableFuture.runAsync(this::drainStderr, executor);
        } catch (RejectedExecutionException e) {
            log.error("[{}] Bridge is shutting down, cannot relay process output", name());
            close(CloseReasons.shuttingDown());
            return;
        }

        started.onExit()
                .thenCombine(stdoutDrained, (p, v) -> p)
                .thenAccept(p -> {
                    log.info("[{}] Process exited with code {}", name(), p.exitValue());
                    close(CloseReasons.processExited());
                });
    }

    /**
     * 将一条消息写入进程 stdin，并追加一个换行符。清理开始之后到达的消息会被丢弃。
     */
    public void sendToProcess(String payload) {
        if (state.get() != SessionState.ACTIVE) {
            log.debug("[{}] Session {} is {}, dropping inbound message", name(), id(), state.get());
            return;
        }
        touch();
        try {
            synchronized (stdinLock) {
                stdin.write(payload);
                stdin.write('\n');
                stdin.flush();
            }
        } catch (IOException e) {
            Process p = process;
            if (p != null && !p.isAlive()) {
                log.info("[{}] Process already exited, input not delivered", name());
                close(CloseReasons.processExited());
            } else {
                log.warn("[{}] Failed to write to process stdin: {}", name(), e.getMessage());
                close(CloseReasons.serverError("Failed to write to process: " + e.getMessage()));
            }
        }
    }

    /**
     * 清理会话：终止进程、关闭 stdin，若连接仍打开则以 {@code status} 关闭。只有第一次调用生效。
     *
     * @return 本次调用执行了清理时返回 true。
     */
    public boolean close(CloseStatus status) {
        SessionState previous = state.getAndUpdate(
                s -> s == SessionState.CONNECTING || s == SessionState.ACTIVE ? SessionState.CLOSING : s);
        if (previous == SessionState.CLOSING || previous == SessionState.CLOSED) {
            return false;
        }

        log.info("[{}] Cleaning up session {} ({})", name(), id(), status);
        terminateProcess();
        closeStdin();
        closeConnection(status);
        state.set(SessionState.CLOSED);
        closeFuture.complete(status);
        return true;
    }

    private void drainStdout() {
        Process p = process;
        try (Reader reader = new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8)) {
            char[] buffer = new char[READ_BUFFER_SIZE];
            int read;
            while ((read = reader.read(buffer)) != -1) {
                for (String message : framer.feed(CharBuffer.wrap(buffer, 0, read))) {
                    forward(message);
                }
            }
        } catch (IOException e) {
            // 终止进程会关闭读取端下方的管道
            if (state.get() == SessionState.ACTIVE) {
                log.warn("[{}] Error reading process stdout: {}", name(), e.getMessage());
            } else {
                log.debug("[{}] stdout closed during teardown: {}", name(), e.getMessage());
            }
        } finally {
            if (framer.hasResidual()) {
                log.debug("[{}] Discarding {} unterminated characters at end of stdout",
                        name(), framer.residual().length());
                framer.clear();
            }
        }
    }

    private void drainStderr() {
        Process p = process;
        try (var reader = new BufferedReader(new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    log.warn("[{}] STDERR: {}", name(), line.trim());
                }
            }
        } catch (IOException e) {
            log.debug("[{}] stderr closed: {}", name(), e.getMessage());
        }
    }

    private void forward(String message) {
        if (!connection.isOpen()) {
            return;
        }
        try {
            connection.sendMessage(new TextMessage(message));
            touch();
        } catch (SessionLimitExceededException e) {
            // 装饰器已关闭连接，afterConnectionClosed 会完成清理
            log.warn("[{}] Client too slow, send limit exceeded: {}", name(), e.getMessage());
        } catch (IllegalStateException e) {
            log.debug("[{}] Connection closed while forwarding: {}", name(), e.getMessage());
        } catch (IOException e) {
            log.warn("[{}] Failed to send message to client: {}", name(), e.getMessage());
            close(CloseReasons.serverError("Failed to send to client"));
        }
    }

    private void terminateProcess() {
        Process p = process;
        if (p == null || !p.isAlive()) {
            return;
        }
        // npx 和 shell 包装会派生出真正的服务器进程，需要连同子进程一起终止
        List<ProcessHandle> descendants = p.descendants().toList();
        descendants.forEach(ProcessHandle::destroy);
        p.destroy();
        p.onExit()
                .orTimeout(terminationGrace.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    log.warn("[{}] PID {} ignored termination for {} ms, killing it",
                            name(), p.pid(), terminationGrace.toMillis());
                    descendants.forEach(ProcessHandle::destroyForcibly);
                    p.destroyForcibly();
                    return p;
                });
    }

    /**
     * 当前仍存活的进程及其所有子孙进程的快照。
     * 关闭会话之前获取，因为父进程退出后子进程会被重新挂到 init 下，无法再通过父进程找到。
     */
    public List<ProcessHandle> liveProcessTree() {
        Process p = process;
        if (p == null || !p.isAlive()) {
            return List.of();
        }
        List<ProcessHandle> tree = new ArrayList<>(p.descendants().toList());
        tree.add(p.toHandle());
        return tree;
    }

    private void closeStdin() {
        BufferedWriter writer = stdin;
        if (writer == null) {
            return;
        }
        synchronized (stdinLock) {
            try {
                writer.close();
            } catch (IOException e) {
                log.debug("[{}] Error closing process stdin: {}", name(), e.getMessage());
            }
        }
    }

    private void closeConnection(CloseStatus status) {
        if (!connection.isOpen()) {
            return;
        }
        try {
            connection.close(status);
        } catch (IOException e) {
            log.warn("[{}] Error closing connection {}: {}", name(), id(), e.getMessage());
        }
    }

    private void touch() {
        lastActivityNanos = System.nanoTime();
    }

    /** 两个方向都没有消息经过的时长。 */
    public Duration idleTime() {
        return Duration.ofNanos(System.nanoTime() - lastActivityNanos);
    }

    public String id() {
        return connection.getId();
    }

    public String name() {
        return spec.name();
    }

    public SpawnSpec spec() {
        return spec;
    }

    public SessionState state() {
        return state.get();
    }

    public Optional<Process> process() {
        return Optional.ofNullable(process);
    }

    /** 清理完成（或启动失败）后以关闭状态完成。 */
    public CompletableFuture<CloseStatus> closeFuture() {
        return closeFuture;
    }
}
