package com.shuking.ojjudge.model;

import com.shuking.ojjudge.model.enums.ComparisonVerdict;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 输出比较的详细结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComparisonDetails {

    private ComparisonVerdict verdict;

    private String message;

    private String diff;

    /**
     * 解析后的期望输出，仅数值、JSON、数组比较器填充
     */
    private Object expectedParsed;

    private Object actualParsed;

    /**
     * 相似度，取值 [0,1]，匹配时恒为 1.0
     */
    private double similarityScore;

    public boolean isMatch() {
        return verdict == ComparisonVerdict.MATCH;
    }

    public static ComparisonDetails error(String message) {
        return ComparisonDetails.builder().verdict(ComparisonVerdict.ERROR).message(message).similarityScore(0.0).build();
    }
}
