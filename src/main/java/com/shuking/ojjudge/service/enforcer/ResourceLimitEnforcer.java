package com.shuking.ojjudge.service.enforcer;

import cn.hutool.core.util.StrUtil;
import com.shuking.ojjudge.config.JudgeProperties;
import com.shuking.ojjudge.exception.SandboxException;
import com.shuking.ojjudge.model.ExecuteMessage;
import com.shuking.ojjudge.model.ResourceLimits;
import com.shuking.ojjudge.model.RunResult;
import com.shuking.ojjudge.model.enums.RunStatus;
import com.shuking.ojjudge.util.ProcessUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StopWatch;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * 在内核资源上限下启动单个进程，负责计时、采样和超时后杀死整个进程组。
 * <p>
 * Linux 下命令形如 {@code setsid prlimit --cpu=S:S+1 --as=B ... -- <command>}：
 * setsid 让目标成为进程组组长（pgid 等于 pid），prlimit 先给自己设置上限再 exec 目标，
 * 所以限制在目标的第一条指令之前就已生效
 */
@Slf4j
@Component
public class ResourceLimitEnforcer {

    private static final String SETSID = "setsid";

    private static final String PRLIMIT = "prlimit";

    private static final long MB = 1024L * 1024L;

    /**
     * 目标无法启动时错误输出的前缀
     */
    public static final String LAUNCH_FAILURE_PREFIX = "Failed to start process: ";

    /**
     * prlimit 无法 exec 目标时打印的错误
     */
    private static final Pattern EXEC_FAILURE_PATTERN = Pattern.compile("^(?:prlimit|setsid): failed to execute");

    private final JudgeProperties judgeProperties;

    private final ProcessMemorySampler memorySampler;

    public ResourceLimitEnforcer(JudgeProperties judgeProperties, ProcessMemorySampler memorySampler) {
        this.judgeProperties = judgeProperties;
        this.memorySampler = memorySampler;
    }

    /**
     * 在资源限制下执行命令并归类运行状态
     *
     * @param request 启动参数
     * @return 运行结果，用户程序的各种失败都不会抛异常
     * @throws SandboxException 沙箱自身无法施加限制或无法启动进程
     */
    public RunResult execute(LaunchRequest request) {
        SignalTable signalTable = requireLauncher();
        ResourceLimits limits = request.getLimits();
        List<String> command = buildLaunchCommand(request);

        ProcessBuilder processBuilder = new ProcessBuilder(command).directory(request.getWorkDir());
        Map<String, String> environment = processBuilder.environment();
        environment.clear();
        environment.put("PATH", StrUtil.blankToDefault(System.getenv("PATH"), "/usr/local/bin:/usr/bin:/bin"));
        environment.put("LANG", "C.UTF-8");
        environment.put("HOME", request.getWorkDir().getAbsolutePath());
        environment.putAll(request.getEnvironment());
        if (request.getStdinFile() != null) {
            processBuilder.redirectInput(request.getStdinFile());
        } else {
            processBuilder.redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")));
        }
        processBuilder.redirectOutput(request.getStdoutFile());
        processBuilder.redirectError(request.getStderrFile());

        StopWatch stopWatch = new StopWatch();
        stopWatch.start();
        Process process;
        try {
            process = processBuilder.start();
        } catch (IOException e) {
            throw new SandboxException("failed to launch sandboxed process: " + e.getMessage(), e);
        }

        long peakKb = 0L;
        long cpuTimeMs = 0L;
        boolean timedOut = false;
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(limits.getWallClockMs());
        try {
            while (true) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    timedOut = process.isAlive();
                    break;
                }
                if (process.waitFor(Math.min(judgeProperties.getSampleIntervalMs(), remainingMs), TimeUnit.MILLISECONDS)) {
                    break;
                }
                ProcessMemorySampler.Usage usage = memorySampler.sampleTree(process.toHandle());
                peakKb = Math.max(peakKb, usage.getResidentKb());
                cpuTimeMs = Math.max(cpuTimeMs, usage.getCpuTimeMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ProcessUtils.destroyProcessTree(process);
            throw new SandboxException("interrupted while waiting for sandboxed process", e);
        }
        // 无论是否超时都清理整个进程组，避免后台子进程存活
        ProcessUtils.destroyProcessTree(process);
        stopWatch.stop();
        if (timedOut) {
            log.info("process {} killed after wall clock limit {} ms", process.pid(), limits.getWallClockMs());
        }

        int maxLogBytes = judgeProperties.getMaxLogBytes();
        int maxOutputBytes = (int) Math.min(Integer.MAX_VALUE - 64L, limits.getFileSizeMb() * MB);
        ExecuteMessage executeMessage = ExecuteMessage.builder()
                .exitValue(timedOut ? -1 : process.exitValue())
                .message(ProcessUtils.readBounded(request.getStdoutFile(), maxOutputBytes))
                .errorMessage(ProcessUtils.readBounded(request.getStderrFile(), maxLogBytes))
                .time(stopWatch.getTotalTimeMillis())
                .memory(peakKb)
                .cpuTime(cpuTimeMs)
                .timedOut(timedOut)
                .build();
        return classify(executeMessage, limits, signalTable);
    }

    /**
     * 按优先级把原始执行信息归类为运行状态：墙钟超时、CPU 信号、OOM 信号、文件大小信号、非零退出、正常
     *
     * @param executeMessage 原始执行信息
     * @param limits         本次使用的限制
     * @param signalTable    当前系统的信号表
     * @return 运行结果
     */
    public static RunResult classify(ExecuteMessage executeMessage, ResourceLimits limits, SignalTable signalTable) {
        RunResult.RunResultBuilder builder = RunResult.builder()
                .exitCode(executeMessage.getExitValue() == null ? -1 : executeMessage.getExitValue())
                .timeMs(executeMessage.getTime() == null ? 0L : executeMessage.getTime())
                .memoryMb(executeMessage.getMemory() == null ? 0.0 : executeMessage.getMemory() / 1024.0)
                .stdout(StrUtil.nullToEmpty(executeMessage.getMessage()));
        String stderr = StrUtil.nullToEmpty(executeMessage.getErrorMessage());

        if (executeMessage.isTimedOut()) {
            return builder.status(RunStatus.TIMEOUT)
                    .signal(signalTable.getKillSignal())
                    .killedByLimit("wall_clock_timeout")
                    .stderr(appendLine(stderr, String.format("Process killed after exceeding wall clock limit of %d ms", limits.getWallClockMs())))
                    .build();
        }

        int exitValue = executeMessage.getExitValue() == null ? -1 : executeMessage.getExitValue();
        Integer signal = signalTable.decodeSignal(exitValue);
        if (signal != null) {
            builder.signal(signal);
            if (signal == signalTable.getCpuLimitSignal()) {
                return builder.status(RunStatus.TLE).killedByLimit("cpu_time")
                        .stderr(appendLine(stderr, String.format("CPU time limit of %d ms exceeded", limits.getCpuTimeMs())))
                        .build();
            }
            if (signal == signalTable.getKillSignal()) {
                // SIGXCPU 被忽略时，到达 CPU 硬限制同样是 SIGKILL
                Long cpuTime = executeMessage.getCpuTime();
                if (cpuTime != null && cpuTime >= limits.getCpuTimeMs()) {
                    return builder.status(RunStatus.TLE).killedByLimit("cpu_time")
                            .stderr(appendLine(stderr, String.format("CPU time limit of %d ms exceeded", limits.getCpuTimeMs())))
                            .build();
                }
                return builder.status(RunStatus.MLE).killedByLimit("memory")
                        .stderr(appendLine(stderr, String.format("Killed by %s (memory limit %d MB)", signalTable.nameOf(signal), limits.getMemoryMb())))
                        .build();
            }
            if (signal == signalTable.getFileSizeSignal()) {
                return builder.status(RunStatus.OLE).killedByLimit("file_size")
                        .stderr(appendLine(stderr, String.format("Output limit of %d MB exceeded", limits.getFileSizeMb())))
                        .build();
            }
            return builder.status(RunStatus.RE)
                    .stderr(appendLine(stderr, "Killed by " + signalTable.nameOf(signal)))
                    .build();
        }
        if (exitValue != 0) {
            if (EXEC_FAILURE_PATTERN.matcher(stderr).find()) {
                return builder.status(RunStatus.RE).stderr(LAUNCH_FAILURE_PREFIX + stderr.trim()).build();
            }
            return builder.status(RunStatus.RE).stderr(stderr).build();
        }
        return builder.status(RunStatus.OK).stderr(stderr).build();
    }

    /**
     * 拼出带资源上限的完整启动命令
     */
    List<String> buildLaunchCommand(LaunchRequest request) {
        ResourceLimits limits = request.getLimits();
        long cpuSeconds = Math.max(1L, (limits.getCpuTimeMs() + 999L) / 1000L);
        long addressSpaceBytes = (limits.getMemoryMb() + (long) request.getAddressSpaceHeadroomMb()) * MB;

        List<String> command = new ArrayList<>();
        command.add(SETSID);
        command.add(PRLIMIT);
        // 软限制触发 SIGXCPU，硬限制多留一秒兜底
        command.add(String.format("--cpu=%d:%d", cpuSeconds, cpuSeconds + 1));
        command.add("--as=" + addressSpaceBytes);
        command.add("--stack=" + limits.getStackMb() * MB);
        command.add("--fsize=" + limits.getFileSizeMb() * MB);
        command.add("--nofile=" + limits.getOpenFiles());
        command.add("--nproc=" + limits.getProcesses());
        command.add("--");
        command.addAll(request.getCommand());
        return command;
    }

    /**
     * 检查能否施加内核级限制，不能时拒绝执行，不存在无限制的降级路径
     */
    private SignalTable requireLauncher() {
        SignalTable signalTable = SignalTable.current();
        if (signalTable != SignalTable.LINUX) {
            throw new SandboxException("kernel resource limits are only supported on Linux, current os: " + System.getProperty("os.name"));
        }
        if (!ProcessUtils.which(SETSID).isPresent() || !ProcessUtils.which(PRLIMIT).isPresent()) {
            throw new SandboxException("setsid/prlimit (util-linux) not found on PATH");
        }
        return signalTable;
    }

    private static String appendLine(String text, String line) {
        if (StrUtil.isBlank(text)) {
            return line;
        }
        return StrUtil.removeSuffix(text, "\n") + "\n" + line;
    }
}
