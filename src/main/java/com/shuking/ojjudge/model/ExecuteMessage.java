package com.shuking.ojjudge.model;

import lombok.Builder;
import lombok.Data;

/**
 * 进程执行的原始信息，尚未归类为运行状态
 */
@Data
@Builder
public class ExecuteMessage {
    // 进程退出码，被信号终止时为 128 + 信号值
    private Integer exitValue;
    // 标准输出
    private String message;
    // 错误输出
    private String errorMessage;
    // 程序执行耗时
    private Long time;
    // 采样到的峰值内存（KB）
    private Long memory;
    // 采样到的 CPU 时间（毫秒）
    private Long cpuTime;
    // 是否因墙钟超时被杀死
    private boolean timedOut;
}
