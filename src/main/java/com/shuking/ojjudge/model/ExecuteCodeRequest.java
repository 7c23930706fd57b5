package com.shuking.ojjudge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecuteCodeRequest {

    private String language;

    private String code;

    /**
     * 按顺序执行的测试用例
     */
    private List<TestCase> testCases;

    /**
     * 题目级别的资源限制覆盖
     */
    private LimitOverride limits;

    /**
     * 是否总是返回编译日志
     */
    private boolean verbose;
}
