package com.shuking.ojjudge.model.enums;

/**
 * 输出比较结果
 */
public enum ComparisonVerdict {
    MATCH,
    MISMATCH,
    /**
     * 输出无法解析，与 MISMATCH 区分
     */
    ERROR
}
