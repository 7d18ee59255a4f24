/**
 * ProcessLauncher.java
 *
 * 根据 SpawnSpec 启动操作系统进程。
 * 命令和参数以列表形式传递（不经过 shell），环境变量为桥接进程自身的环境叠加配置中的覆盖项，
 * 工作目录为桥接进程的工作目录。
 * stdout 与 stderr 保持为两条独立的管道：stdout 承载协议消息，stderr 只写入日志。
 */
package club.ppmc.bridge.service;

import club.ppmc.bridge.exception.SpawnFailureException;
import club.ppmc.bridge.model.SpawnSpec;
import java.io.File;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class ProcessLauncher {

    private final File workingDirectory = new File(System.getProperty("user.dir"));

    /**
     * @param spec 要启动的服务器描述。
     * @return 正在运行的进程。
     * @throws SpawnFailureException 操作系统无法启动该进程时抛出。
     */
    public Process launch(SpawnSpec spec) {
        var processBuilder = new ProcessBuilder(spec.commandLine())
                .directory(workingDirectory)
                .redirectErrorStream(false);
        processBuilder.environment().putAll(spec.env());

        log.info("[{}] Spawning: {}", spec.name(), spec);
        try {
            Process process = processBuilder.start();
            log.info("[{}] Process started, PID: {}", spec.name(), process.pid());
            return process;
        } catch (IOException | SecurityException | UnsupportedOperationException e) {
            throw new SpawnFailureException(spec.name(), e);
        }
    }
}
