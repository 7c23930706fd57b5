package com.shuking.ojjudge.model.enums;

import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 支持的编程语言
 */
public enum LanguageEnum {
    PYTHON("Python 3", "py", "python", "python3"),
    CPP("C++17", "cpp", "c++", "cplusplus"),
    C("C11", "c", "gcc"),
    JAVASCRIPT("JavaScript (Node.js)", "js", "javascript", "node"),
    JAVA("Java", "java");

    private final String text;

    private final String value;

    private final List<String> aliases;

    LanguageEnum(String text, String value, String... aliases) {
        this.text = text;
        this.value = value;
        this.aliases = Arrays.asList(aliases);
    }

    public static List<String> getValues() {
        return Arrays.stream(values()).map(item -> item.value).collect(Collectors.toList());
    }

    /**
     * 根据 value 或别名获取枚举
     *
     * @param value 语言标识
     * @return 枚举，不支持时返回 null
     */
    public static LanguageEnum getEnumByValue(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        String key = value.trim().toLowerCase();
        for (LanguageEnum anEnum : LanguageEnum.values()) {
            if (anEnum.value.equals(key) || anEnum.aliases.contains(key)) {
                return anEnum;
            }
        }
        return null;
    }

    public String getValue() {
        return value;
    }

    public String getText() {
        return text;
    }
}
