package com.shuking.ojjudge.model;

import com.shuking.ojjudge.model.enums.Verdict;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 沙箱判题后的响应体
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecuteCodeResponse {

    private String submissionId;

    /**
     * 整体判题结果
     */
    private Verdict verdict;

    /**
     * 接口信息
     */
    private String message;

    private int passedCount;

    private int totalCount;

    private long totalTimeMs;

    private double averageTimeMs;

    /**
     * 与输入顺序一致的用例结果
     */
    private List<TestCaseResult> results;

    /**
     * 编译日志，仅编译失败或 verbose 时返回
     */
    private String compileLog;

    /**
     * 判题信息
     */
    private JudgeInfo judgeInfo;
}
