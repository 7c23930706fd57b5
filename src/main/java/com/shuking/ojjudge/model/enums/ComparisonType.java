package com.shuking.ojjudge.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 输出比较方式
 */
public enum ComparisonType {
    AUTO("auto"),
    EXACT("exact", "text"),
    NUMERIC("numeric"),
    JSON("json"),
    ARRAY("array");

    private final String value;

    private final List<String> aliases;

    ComparisonType(String value, String... aliases) {
        this.value = value;
        this.aliases = Arrays.asList(aliases);
    }

    public static List<String> getValues() {
        return Arrays.stream(values()).map(item -> item.value).collect(Collectors.toList());
    }

    /**
     * 根据 value 获取枚举，大小写不敏感
     *
     * @param value 比较方式名
     * @return 枚举，空值返回 AUTO
     * @throws IllegalArgumentException 未知比较方式
     */
    @JsonCreator
    public static ComparisonType getEnumByValue(String value) {
        if (StringUtils.isBlank(value)) {
            return AUTO;
        }
        String key = value.trim().toLowerCase();
        for (ComparisonType anEnum : ComparisonType.values()) {
            if (anEnum.value.equals(key) || anEnum.aliases.contains(key)) {
                return anEnum;
            }
        }
        throw new IllegalArgumentException("Unknown comparator type: " + value);
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
