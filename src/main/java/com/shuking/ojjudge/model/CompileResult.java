package com.shuking.ojjudge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 编译结果，每次提交只产生一次
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompileResult {

    private boolean success;

    private String stdout;

    private String stderr;

    private int exitCode;

    private long compileTimeMs;

    /**
     * 无需编译的语言直接视为成功
     */
    public static CompileResult skipped() {
        return CompileResult.builder().success(true).stdout("").stderr("").exitCode(0).compileTimeMs(0L).build();
    }

    public static CompileResult failed(String stderr, int exitCode, long compileTimeMs) {
        return CompileResult.builder().success(false).stdout("").stderr(stderr)
                .exitCode(exitCode).compileTimeMs(compileTimeMs).build();
    }
}
