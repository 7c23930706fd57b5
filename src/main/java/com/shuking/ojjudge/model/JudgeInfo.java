package com.shuking.ojjudge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 判题信息，只统计本次提交
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class JudgeInfo {

    /**
     * 程序执行信息
     */
    private String message;

    /**
     * 峰值内存（MB）
     */
    private Double memory;

    /**
     * 最大耗时（毫秒）
     */
    private Long time;

    private Long minTime;

    private Double medianTime;

    private Double averageTime;

    /**
     * 通过率 [0,1]
     */
    private Double passRate;

    /**
     * 平均相似度，用于部分得分分析
     */
    private Double averageSimilarity;
}
