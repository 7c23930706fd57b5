package com.shuking.ojjudge.service.comparator;

import cn.hutool.core.util.StrUtil;
import com.shuking.ojjudge.model.ComparisonDetails;
import com.shuking.ojjudge.model.enums.ComparisonVerdict;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 数组输出比较，兼容 [1, 2]、(1,2)、1 2 等写法
 */
@Slf4j
public class ArrayComparator implements OutputComparator {

    static final String NAME = "Array";

    static final String DEFAULT_SEPARATOR = "[,\\s]+";

    private static final String QUOTES = "\"'";

    private final boolean ignoreOrder;

    private final boolean ignoreBrackets;

    private final Pattern separatorPattern;

    public ArrayComparator() {
        this(false, true, DEFAULT_SEPARATOR);
    }

    /**
     * @throws java.util.regex.PatternSyntaxException 分隔符不是合法正则
     */
    public ArrayComparator(boolean ignoreOrder, boolean ignoreBrackets, String separatorPattern) {
        this.ignoreOrder = ignoreOrder;
        this.ignoreBrackets = ignoreBrackets;
        this.separatorPattern = Pattern.compile(separatorPattern);
    }

    @Override
    public ComparisonDetails compare(String expected, String actual) {
        try {
            List<String> expectedArray = parseArray(StrUtil.nullToEmpty(expected));
            List<String> actualArray = parseArray(StrUtil.nullToEmpty(actual));
            if (ignoreOrder) {
                Collections.sort(expectedArray);
                Collections.sort(actualArray);
            }
            if (expectedArray.equals(actualArray)) {
                return ComparisonDetails.builder()
                        .verdict(ComparisonVerdict.MATCH)
                        .message("Arrays match")
                        .expectedParsed(expectedArray)
                        .actualParsed(actualArray)
                        .similarityScore(1.0)
                        .build();
            }
            double similarity = jaccard(expectedArray, actualArray);
            String message = expectedArray.size() != actualArray.size()
                    ? String.format("Array length mismatch: expected %d, got %d", expectedArray.size(), actualArray.size())
                    : String.format(Locale.ROOT, "Array mismatch (similarity: %.1f%%)", similarity * 100);
            return ComparisonDetails.builder()
                    .verdict(ComparisonVerdict.MISMATCH)
                    .message(message)
                    .diff(diff(expectedArray, actualArray))
                    .expectedParsed(expectedArray)
                    .actualParsed(actualArray)
                    .similarityScore(similarity)
                    .build();
        } catch (RuntimeException e) {
            log.warn("array comparison error", e);
            return ComparisonDetails.error("Array comparison error: " + e.getMessage());
        }
    }

    List<String> parseArray(String text) {
        String body = text.trim();
        if (ignoreBrackets && body.length() >= 2) {
            char first = body.charAt(0);
            char last = body.charAt(body.length() - 1);
            if ((first == '[' && last == ']') || (first == '(' && last == ')')) {
                body = body.substring(1, body.length() - 1);
            }
        }
        List<String> elements = new ArrayList<>();
        if (StrUtil.isBlank(body)) {
            return elements;
        }
        for (String element : separatorPattern.split(body)) {
            String value = StringUtils.strip(element.trim(), QUOTES);
            if (StrUtil.isNotBlank(element)) {
                elements.add(value);
            }
        }
        return elements;
    }

    private static String diff(List<String> expected, List<String> actual) {
        List<String> lines = new ArrayList<>();
        lines.add("Expected: " + expected);
        lines.add("Actual:   " + actual);
        if (expected.size() != actual.size()) {
            lines.add(String.format("Length difference: expected %d, got %d", expected.size(), actual.size()));
        }
        int maxLength = Math.max(expected.size(), actual.size());
        for (int i = 0; i < maxLength; i++) {
            String e = i < expected.size() ? "'" + expected.get(i) + "'" : "<missing>";
            String a = i < actual.size() ? "'" + actual.get(i) + "'" : "<extra>";
            if (!e.equals(a)) {
                lines.add(String.format("  [%d]: %s → %s", i, e, a));
            }
        }
        return String.join("\n", lines);
    }

    static double jaccard(List<String> expected, List<String> actual) {
        if (expected.isEmpty() && actual.isEmpty()) {
            return 1.0;
        }
        if (expected.isEmpty() || actual.isEmpty()) {
            return 0.0;
        }
        Set<String> union = new HashSet<>(expected);
        union.addAll(actual);
        Set<String> intersection = new HashSet<>(expected);
        intersection.retainAll(new HashSet<>(actual));
        return (double) intersection.size() / union.size();
    }

    @Override
    public String getName() {
        return NAME;
    }
}
