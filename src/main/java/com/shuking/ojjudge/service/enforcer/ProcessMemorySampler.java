package com.shuking.ojjudge.service.enforcer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import oshi.SystemInfo;
import oshi.software.os.OSProcess;
import oshi.software.os.OperatingSystem;

import java.util.stream.Collectors;

/**
 * 运行期间对目标进程做内存、CPU 采样，取不到时返回未知，不影响判题
 */
@Slf4j
@Component
public class ProcessMemorySampler {

    private final OperatingSystem operatingSystem;

    public ProcessMemorySampler() {
        this(loadOperatingSystem());
    }

    ProcessMemorySampler(OperatingSystem operatingSystem) {
        this.operatingSystem = operatingSystem;
    }

    private static OperatingSystem loadOperatingSystem() {
        try {
            return new SystemInfo().getOperatingSystem();
        } catch (UnsupportedOperationException | LinkageError e) {
            log.warn("process sampling unavailable on this platform: {}", e.getMessage());
            return null;
        }
    }

    /**
     * 采样一次
     *
     * @param pid 进程号
     * @return 常驻内存与累计 CPU 时间
     */
    public Usage sample(long pid) {
        if (operatingSystem == null) {
            return Usage.UNKNOWN;
        }
        try {
            OSProcess process = operatingSystem.getProcess((int) pid);
            if (process == null) {
                return Usage.UNKNOWN;
            }
            return new Usage(process.getResidentSetSize() / 1024L, process.getUserTime() + process.getKernelTime());
        } catch (RuntimeException e) {
            log.debug("sample pid {} failed: {}", pid, e.getMessage());
            return Usage.UNKNOWN;
        }
    }

    /**
     * 采样进程及其全部后代并求和
     *
     * @param root 根进程
     * @return 合计的常驻内存与 CPU 时间
     */
    public Usage sampleTree(ProcessHandle root) {
        Usage total = sample(root.pid());
        long residentKb = total.getResidentKb();
        long cpuTimeMs = total.getCpuTimeMs();
        for (ProcessHandle child : root.descendants().collect(Collectors.toList())) {
            Usage usage = sample(child.pid());
            residentKb += usage.getResidentKb();
            cpuTimeMs += usage.getCpuTimeMs();
        }
        return new Usage(residentKb, cpuTimeMs);
    }

    /**
     * 一次采样结果
     */
    public static final class Usage {

        public static final Usage UNKNOWN = new Usage(0L, 0L);

        private final long residentKb;

        private final long cpuTimeMs;

        public Usage(long residentKb, long cpuTimeMs) {
            this.residentKb = residentKb;
            this.cpuTimeMs = cpuTimeMs;
        }

        public long getResidentKb() {
            return residentKb;
        }

        public long getCpuTimeMs() {
            return cpuTimeMs;
        }
    }
}
