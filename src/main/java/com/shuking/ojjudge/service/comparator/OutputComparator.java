package com.shuking.ojjudge.service.comparator;

import com.shuking.ojjudge.model.ComparisonDetails;

/**
 * 输出比较策略，比较过程不抛异常，输入无法解析时返回 ERROR
 */
public interface OutputComparator {

    ComparisonDetails compare(String expected, String actual);

    /**
     * 比较器名称，写入用例结果
     */
    String getName();
}
