package com.shuking.ojjudge.model;

import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.Validate;

/**
 * 单个进程的资源上限，构造时校验，之后不可变
 */
@Value
public class ResourceLimits {

    /**
     * 墙钟时间上限（毫秒）
     */
    long wallClockMs;

    /**
     * CPU 时间上限（毫秒）
     */
    long cpuTimeMs;

    /**
     * 虚拟内存上限（MB）
     */
    int memoryMb;

    /**
     * 栈大小上限（MB）
     */
    int stackMb;

    /**
     * 输出文件大小上限（MB）
     */
    int fileSizeMb;

    /**
     * 文件描述符数量上限
     */
    int openFiles;

    /**
     * 进程数量上限
     */
    int processes;

    @Builder(toBuilder = true)
    public ResourceLimits(long wallClockMs, long cpuTimeMs, int memoryMb, int stackMb,
                          int fileSizeMb, int openFiles, int processes) {
        Validate.isTrue(wallClockMs > 0, "wallClockMs must be positive: %d", wallClockMs);
        Validate.isTrue(cpuTimeMs > 0, "cpuTimeMs must be positive: %d", cpuTimeMs);
        Validate.isTrue(memoryMb > 0, "memoryMb must be positive: %d", memoryMb);
        Validate.isTrue(stackMb > 0, "stackMb must be positive: %d", stackMb);
        Validate.isTrue(fileSizeMb > 0, "fileSizeMb must be positive: %d", fileSizeMb);
        Validate.isTrue(openFiles > 0, "openFiles must be positive: %d", openFiles);
        Validate.isTrue(processes > 0, "processes must be positive: %d", processes);
        this.wallClockMs = wallClockMs;
        this.cpuTimeMs = cpuTimeMs;
        this.memoryMb = memoryMb;
        this.stackMb = stackMb;
        this.fileSizeMb = fileSizeMb;
        this.openFiles = openFiles;
        this.processes = processes;
    }

    /**
     * 用非空字段覆盖当前限制，返回新实例
     *
     * @param override 覆盖项，可为 null
     * @return 合并后的限制
     */
    public ResourceLimits override(LimitOverride override) {
        if (override == null) {
            return this;
        }
        ResourceLimitsBuilder builder = toBuilder();
        if (override.getWallClockMs() != null) {
            builder.wallClockMs(override.getWallClockMs());
        }
        if (override.getCpuTimeMs() != null) {
            builder.cpuTimeMs(override.getCpuTimeMs());
        }
        if (override.getMemoryMb() != null) {
            builder.memoryMb(override.getMemoryMb());
        }
        if (override.getStackMb() != null) {
            builder.stackMb(override.getStackMb());
        }
        if (override.getFileSizeMb() != null) {
            builder.fileSizeMb(override.getFileSizeMb());
        }
        if (override.getOpenFiles() != null) {
            builder.openFiles(override.getOpenFiles());
        }
        if (override.getProcesses() != null) {
            builder.processes(override.getProcesses());
        }
        return builder.build();
    }

    /**
     * 测试用例级别的时间、内存覆盖。用例时限替换墙钟时限，CPU 时限至少放宽到用例时限
     *
     * @param testCase 测试用例
     * @return 合并后的限制
     */
    public ResourceLimits override(TestCase testCase) {
        if (testCase == null) {
            return this;
        }
        Long timeLimitMs = testCase.getTimeLimitMs();
        return override(LimitOverride.builder()
                .wallClockMs(timeLimitMs)
                .cpuTimeMs(timeLimitMs == null ? null : Math.max(cpuTimeMs, timeLimitMs))
                .memoryMb(testCase.getMemoryLimitMb())
                .build());
    }
}
