package com.shuking.ojjudge.model;

import com.shuking.ojjudge.model.enums.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个测试用例的运行结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunResult {

    private RunStatus status;

    private int exitCode;

    /**
     * 耗时（毫秒）
     */
    private long timeMs;

    /**
     * 峰值内存（MB），未知时为 0
     */
    private double memoryMb;

    private String stdout;

    private String stderr;

    /**
     * 终止进程的信号，正常退出时为空
     */
    private Integer signal;

    /**
     * 触发终止的限制项，如 wall_clock_timeout
     */
    private String killedByLimit;

    public static RunResult internalError(String message) {
        return RunResult.builder().status(RunStatus.IE).exitCode(-1).stdout("").stderr(message).build();
    }
}
