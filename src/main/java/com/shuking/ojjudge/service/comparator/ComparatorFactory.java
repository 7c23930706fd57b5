package com.shuking.ojjudge.service.comparator;

import cn.hutool.core.convert.Convert;
import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.shuking.ojjudge.model.enums.ComparisonType;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * 比较器工厂：按类型和参数创建，或按输出形态自动选择
 */
public final class ComparatorFactory {

    private static final Pattern NUMERIC_LIST_PATTERN = Pattern.compile(
            "^[-+]?(?:\\d+\\.?\\d*|\\.\\d+|inf(?:inity)?|nan)(?:[eE][-+]?\\d+)?"
                    + "(?:\\s*,?\\s*[-+]?(?:\\d+\\.?\\d*|\\.\\d+|inf(?:inity)?|nan)(?:[eE][-+]?\\d+)?)*$",
            Pattern.CASE_INSENSITIVE);

    private static final Set<String> TEXT_KEYS = keys("case_sensitive", "normalize_whitespace", "ignore_trailing_whitespace");

    private static final Set<String> NUMERIC_KEYS = keys("epsilon", "relative_tolerance", "allow_scientific_notation");

    private static final Set<String> JSON_KEYS = keys("ignore_order", "ignore_extra_fields", "numeric_tolerance");

    private static final Set<String> ARRAY_KEYS = keys("ignore_order", "ignore_brackets", "separator_pattern");

    private ComparatorFactory() {
    }

    /**
     * 按名称创建比较器
     *
     * @param type   比较方式名，如 exact、numeric
     * @param config 参数，可为空
     * @return 比较器
     * @throws IllegalArgumentException 未知类型或未知参数
     */
    public static OutputComparator create(String type, Map<String, Object> config) {
        return create(ComparisonType.getEnumByValue(type), config);
    }

    /**
     * 按类型创建比较器
     *
     * @param type   比较方式，不能为 AUTO
     * @param config 参数，可为空
     * @return 比较器
     * @throws IllegalArgumentException 未知参数或参数值非法
     */
    public static OutputComparator create(ComparisonType type, Map<String, Object> config) {
        Map<String, Object> params = config == null ? Collections.emptyMap() : config;
        if (type == null) {
            throw new IllegalArgumentException("Unknown comparator type: null");
        }
        switch (type) {
            case EXACT:
                checkKeys(type, params, TEXT_KEYS);
                return new TextExactComparator(
                        getBool(params, "case_sensitive", true),
                        getBool(params, "normalize_whitespace", true),
                        getBool(params, "ignore_trailing_whitespace", true));
            case NUMERIC:
                checkKeys(type, params, NUMERIC_KEYS);
                return new NumericComparator(
                        getDouble(params, "epsilon", 1e-9),
                        getDouble(params, "relative_tolerance", 1e-6),
                        getBool(params, "allow_scientific_notation", true));
            case JSON:
                checkKeys(type, params, JSON_KEYS);
                return new JsonComparator(
                        getBool(params, "ignore_order", true),
                        getBool(params, "ignore_extra_fields", false),
                        getDouble(params, "numeric_tolerance", 1e-9));
            case ARRAY:
                checkKeys(type, params, ARRAY_KEYS);
                return new ArrayComparator(
                        getBool(params, "ignore_order", false),
                        getBool(params, "ignore_brackets", true),
                        StrUtil.blankToDefault(Convert.toStr(params.get("separator_pattern")), ArrayComparator.DEFAULT_SEPARATOR));
            default:
                throw new IllegalArgumentException("Comparator type 'auto' is chosen from the outputs, use autoDetect");
        }
    }

    /**
     * 按期望输出与实际输出的形态选择比较器：
     * 两边都是括号包裹的简单数组用数组比较，都是 JSON 用 JSON 比较，都是数字序列用数值比较，否则按文本比较
     *
     * @param expected 期望输出
     * @param actual   实际输出
     * @return 默认参数的比较器
     */
    public static OutputComparator autoDetect(String expected, String actual) {
        String expectedText = StrUtil.nullToEmpty(expected).trim();
        String actualText = StrUtil.nullToEmpty(actual).trim();

        JsonNode expectedJson = JsonComparator.tryParse(expectedText);
        JsonNode actualJson = JsonComparator.tryParse(actualText);
        if (isWrapped(expectedText) && isWrapped(actualText)) {
            if (expectedJson == null || actualJson == null) {
                return new ArrayComparator();
            }
            if (expectedJson.isArray() && actualJson.isArray() && isPrimitiveList(expectedJson)) {
                return new ArrayComparator();
            }
        }
        if (expectedJson != null && actualJson != null) {
            return new JsonComparator();
        }
        if (NUMERIC_LIST_PATTERN.matcher(expectedText).matches() && NUMERIC_LIST_PATTERN.matcher(actualText).matches()) {
            return new NumericComparator();
        }
        return new TextExactComparator();
    }

    private static boolean isWrapped(String text) {
        return (text.startsWith("[") && text.endsWith("]")) || (text.startsWith("(") && text.endsWith(")"));
    }

    private static boolean isPrimitiveList(JsonNode array) {
        Iterator<JsonNode> elements = array.elements();
        while (elements.hasNext()) {
            if (elements.next().isContainerNode()) {
                return false;
            }
        }
        return true;
    }

    private static void checkKeys(ComparisonType type, Map<String, Object> params, Set<String> allowed) {
        for (String key : params.keySet()) {
            if (!allowed.contains(key)) {
                throw new IllegalArgumentException(String.format("Unknown config key '%s' for comparator %s, allowed: %s",
                        key, type.getValue(), allowed));
            }
        }
    }

    private static boolean getBool(Map<String, Object> params, String key, boolean defaultValue) {
        Object value = params.get(key);
        if (value == null) {
            return defaultValue;
        }
        Boolean converted = Convert.toBool(value, null);
        if (converted == null) {
            throw new IllegalArgumentException(String.format("Invalid boolean for '%s': %s", key, value));
        }
        return converted;
    }

    private static double getDouble(Map<String, Object> params, String key, double defaultValue) {
        Object value = params.get(key);
        if (value == null) {
            return defaultValue;
        }
        double converted;
        if (value instanceof Number) {
            converted = ((Number) value).doubleValue();
        } else {
            try {
                converted = Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(String.format("Invalid number for '%s': %s", key, value), e);
            }
        }
        if (Double.isNaN(converted) || converted < 0) {
            throw new IllegalArgumentException(String.format("Invalid number for '%s': %s", key, value));
        }
        return converted;
    }

    private static Set<String> keys(String... names) {
        return Collections.unmodifiableSet(new TreeSet<>(Arrays.asList(names)));
    }
}
