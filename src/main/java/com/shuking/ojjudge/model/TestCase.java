package com.shuking.ojjudge.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.shuking.ojjudge.model.enums.ComparisonType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * 测试用例，由上游测试数据服务提供，交给沙箱后不再修改
 */
@Value
@Builder
@Jacksonized
public class TestCase {

    /**
     * 用例编号，同一次判题内唯一
     */
    String id;

    /**
     * 标准输入
     */
    @JsonAlias({"input_data"})
    String input;

    /**
     * 期望输出
     */
    @JsonAlias({"expected_output", "output"})
    String expectedOutput;

    /**
     * 用例级别时间限制（毫秒），可为空
     */
    @JsonAlias({"time_limit_ms"})
    Long timeLimitMs;

    /**
     * 用例级别内存限制（MB），可为空
     */
    @JsonAlias({"memory_limit_mb"})
    Integer memoryLimitMb;

    /**
     * 比较方式
     */
    @JsonAlias({"comparison_type"})
    @Builder.Default
    ComparisonType comparisonType = ComparisonType.AUTO;

    /**
     * 比较器参数
     */
    @JsonAlias({"comparison_config"})
    Map<String, Object> comparisonConfig;
}
