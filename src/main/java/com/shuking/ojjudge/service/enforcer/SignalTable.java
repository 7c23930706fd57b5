package com.shuking.ojjudge.service.enforcer;

import cn.hutool.system.OsInfo;
import cn.hutool.system.SystemUtil;

/**
 * 各操作系统的信号表。JDK 在进程被信号终止时返回 128 + 信号值作为退出码，
 * 这里按系统显式列出判题关心的信号，而不是靠退出码推算
 */
public enum SignalTable {

    LINUX(24, 9, 25, new String[]{
            null, "SIGHUP", "SIGINT", "SIGQUIT", "SIGILL", "SIGTRAP", "SIGABRT", "SIGBUS", "SIGFPE",
            "SIGKILL", "SIGUSR1", "SIGSEGV", "SIGUSR2", "SIGPIPE", "SIGALRM", "SIGTERM", "SIGSTKFLT",
            "SIGCHLD", "SIGCONT", "SIGSTOP", "SIGTSTP", "SIGTTIN", "SIGTTOU", "SIGURG", "SIGXCPU",
            "SIGXFSZ", "SIGVTALRM", "SIGPROF", "SIGWINCH", "SIGIO", "SIGPWR", "SIGSYS"}),

    MAC_OS(24, 9, 25, new String[]{
            null, "SIGHUP", "SIGINT", "SIGQUIT", "SIGILL", "SIGTRAP", "SIGABRT", "SIGEMT", "SIGFPE",
            "SIGKILL", "SIGBUS", "SIGSEGV", "SIGSYS", "SIGPIPE", "SIGALRM", "SIGTERM", "SIGURG",
            "SIGSTOP", "SIGTSTP", "SIGCONT", "SIGCHLD", "SIGTTIN", "SIGTTOU", "SIGIO", "SIGXCPU",
            "SIGXFSZ", "SIGVTALRM", "SIGPROF", "SIGWINCH", "SIGINFO", "SIGUSR1", "SIGUSR2"});

    private static final int SIGNAL_EXIT_OFFSET = 128;

    /**
     * 超过 RLIMIT_CPU 软限制
     */
    private final int cpuLimitSignal;

    /**
     * OOM killer 与 RLIMIT_CPU 硬限制都会发送该信号
     */
    private final int killSignal;

    /**
     * 超过 RLIMIT_FSIZE
     */
    private final int fileSizeSignal;

    private final String[] names;

    SignalTable(int cpuLimitSignal, int killSignal, int fileSizeSignal, String[] names) {
        this.cpuLimitSignal = cpuLimitSignal;
        this.killSignal = killSignal;
        this.fileSizeSignal = fileSizeSignal;
        this.names = names;
    }

    /**
     * 当前系统对应的信号表
     *
     * @return 信号表，非 Linux、macOS 时返回 null
     */
    public static SignalTable current() {
        OsInfo osInfo = SystemUtil.getOsInfo();
        if (osInfo.isLinux()) {
            return LINUX;
        }
        if (osInfo.isMac() || osInfo.isMacOsX()) {
            return MAC_OS;
        }
        return null;
    }

    /**
     * 从退出码解析终止信号
     *
     * @param exitValue 进程退出码
     * @return 信号值，正常退出时返回 null
     */
    public Integer decodeSignal(int exitValue) {
        int signal = exitValue - SIGNAL_EXIT_OFFSET;
        if (signal > 0 && signal < names.length) {
            return signal;
        }
        return null;
    }

    public String nameOf(int signal) {
        if (signal > 0 && signal < names.length) {
            return names[signal];
        }
        return "SIG" + signal;
    }

    public int getCpuLimitSignal() {
        return cpuLimitSignal;
    }

    public int getKillSignal() {
        return killSignal;
    }

    public int getFileSizeSignal() {
        return fileSizeSignal;
    }
}
