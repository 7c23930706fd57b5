package com.shuking.ojjudge.model.enums;

/**
 * 单次进程运行的状态
 */
public enum RunStatus {
    /**
     * 正常退出，退出码为 0
     */
    OK,
    /**
     * 超过墙钟时间，被父进程杀死
     */
    TIMEOUT,
    /**
     * 超过 CPU 时间
     */
    TLE,
    MLE,
    OLE,
    /**
     * 非零退出码、其他信号或无法启动
     */
    RE,
    IE
}
