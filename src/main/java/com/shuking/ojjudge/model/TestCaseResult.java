package com.shuking.ojjudge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.shuking.ojjudge.model.enums.Verdict;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个测试用例的判题结果，对应报告中的一行
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestCaseResult {

    @JsonIgnore
    private TestCase testCase;

    @JsonIgnore
    private RunResult runResult;

    /**
     * 用例判题结果，输出不匹配时由 OK 降级为 WA
     */
    private Verdict status;

    /**
     * 输出差异，仅 WA 时非空
     */
    private String diff;

    private double similarityScore;

    /**
     * 实际使用的比较器名称
     */
    private String comparator;

    public String getTestId() {
        return testCase == null ? null : testCase.getId();
    }

    public String getInput() {
        return testCase == null ? null : testCase.getInput();
    }

    public String getExpectedOutput() {
        return testCase == null ? null : testCase.getExpectedOutput();
    }

    public String getActualOutput() {
        return runResult == null ? null : runResult.getStdout();
    }

    public String getError() {
        return runResult == null ? null : runResult.getStderr();
    }

    public long getTimeMs() {
        return runResult == null ? 0L : runResult.getTimeMs();
    }

    public double getMemoryMb() {
        return runResult == null ? 0.0 : runResult.getMemoryMb();
    }

    public boolean isPassed() {
        return status == Verdict.OK;
    }
}
