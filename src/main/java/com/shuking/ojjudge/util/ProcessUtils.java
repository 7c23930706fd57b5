package com.shuking.ojjudge.util;

import cn.hutool.core.io.FileUtil;
import cn.hutool.core.io.IORuntimeException;
import cn.hutool.core.io.IoUtil;
import cn.hutool.core.util.StrUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 进程相关的工具方法
 */
@Slf4j
public class ProcessUtils {

    private static final String TRUNCATED_MARKER = "\n... [truncated]";

    private static final long REAP_TIMEOUT_MS = 1000L;

    private ProcessUtils() {
    }

    /**
     * 在 PATH 中查找可执行文件
     *
     * @param command 命令名，包含路径分隔符时直接检查该路径
     * @return 可执行文件
     */
    public static Optional<File> which(String command) {
        if (StrUtil.isBlank(command)) {
            return Optional.empty();
        }
        if (command.contains(File.separator)) {
            File file = new File(command);
            return file.isFile() && file.canExecute() ? Optional.of(file) : Optional.empty();
        }
        String path = System.getenv("PATH");
        if (StrUtil.isBlank(path)) {
            return Optional.empty();
        }
        for (String dir : StrUtil.split(path, File.pathSeparator)) {
            if (StrUtil.isBlank(dir)) {
                continue;
            }
            File candidate = new File(dir, command);
            if (candidate.isFile() && candidate.canExecute()) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * 杀死整个进程组，目标进程由 setsid 启动，进程组号等于其 pid
     *
     * @param pgid 进程组号
     * @return kill 命令是否成功，进程组已不存在时返回 false
     */
    public static boolean killProcessGroup(long pgid) {
        ProcessBuilder builder = new ProcessBuilder("kill", "-KILL", "--", "-" + pgid)
                .redirectErrorStream(true);
        try {
            Process killProcess = builder.start();
            String output;
            try (InputStream in = killProcess.getInputStream()) {
                output = IoUtil.read(in, StandardCharsets.UTF_8);
            }
            if (!killProcess.waitFor(REAP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                killProcess.destroyForcibly();
                log.warn("kill -KILL -{} did not finish in time", pgid);
                return false;
            }
            if (killProcess.exitValue() != 0) {
                log.debug("process group {} already gone: {}", pgid, StrUtil.trim(output));
                return false;
            }
            return true;
        } catch (IOException e) {
            log.error("failed to kill process group {}", pgid, e);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("interrupted while killing process group {}", pgid);
            return false;
        }
    }

    /**
     * 强制结束进程及其全部后代，最后回收主进程
     *
     * @param process 进程
     */
    public static void destroyProcessTree(Process process) {
        // 先收集后代，主进程一旦退出后代会被过继，无法再通过它找到
        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        killProcessGroup(process.pid());
        descendants.forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(REAP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("process {} still alive after SIGKILL", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("interrupted while reaping process {}", process.pid());
        }
    }

    /**
     * 读取文件前 maxBytes 字节，超出部分截断并追加标记
     *
     * @param file     文件
     * @param maxBytes 最大字节数
     * @return 文件内容，文件不存在时为空串
     */
    public static String readBounded(File file, int maxBytes) {
        if (file == null || !FileUtil.isFile(file)) {
            return "";
        }
        long length = file.length();
        if (length <= maxBytes) {
            return FileUtil.readString(file, StandardCharsets.UTF_8);
        }
        try (InputStream in = FileUtil.getInputStream(file)) {
            byte[] head = IoUtil.readBytes(in, maxBytes);
            return new String(head, StandardCharsets.UTF_8) + TRUNCATED_MARKER;
        } catch (IOException | IORuntimeException e) {
            log.error("read {} error", file.getAbsolutePath(), e);
            return "";
        }
    }
}
