package com.shuking.ojjudge.service.comparator;

import cn.hutool.core.util.StrUtil;
import com.shuking.ojjudge.model.ComparisonDetails;
import com.shuking.ojjudge.model.enums.ComparisonVerdict;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 文本比较，可选忽略大小写、行尾空白、连续空白
 */
@Slf4j
public class TextExactComparator implements OutputComparator {

    static final String NAME = "TextExact";

    /**
     * 短于该长度的行额外给出逐字符差异
     */
    private static final int CHAR_DIFF_MAX_LENGTH = 100;

    /**
     * 超过该长度不再计算编辑距离，改为按位置比对行
     */
    private static final int LEVENSHTEIN_MAX_LENGTH = 4096;

    private static final int MAX_DIFF_LINES = 50;

    private final boolean caseSensitive;

    private final boolean normalizeWhitespace;

    private final boolean ignoreTrailingWhitespace;

    public TextExactComparator() {
        this(true, true, true);
    }

    public TextExactComparator(boolean caseSensitive, boolean normalizeWhitespace, boolean ignoreTrailingWhitespace) {
        this.caseSensitive = caseSensitive;
        this.normalizeWhitespace = normalizeWhitespace;
        this.ignoreTrailingWhitespace = ignoreTrailingWhitespace;
    }

    @Override
    public ComparisonDetails compare(String expected, String actual) {
        try {
            String expectedText = StrUtil.nullToEmpty(expected);
            String actualText = StrUtil.nullToEmpty(actual);
            String expectedNormalized = normalize(expectedText);
            String actualNormalized = normalize(actualText);
            if (expectedNormalized.equals(actualNormalized)) {
                return ComparisonDetails.builder()
                        .verdict(ComparisonVerdict.MATCH)
                        .message("Output matches exactly")
                        .similarityScore(1.0)
                        .build();
            }
            double similarity = similarity(expectedNormalized, actualNormalized);
            return ComparisonDetails.builder()
                    .verdict(ComparisonVerdict.MISMATCH)
                    .message(String.format(Locale.ROOT, "Text mismatch (similarity: %.1f%%)", similarity * 100))
                    .diff(diff(expectedText, actualText))
                    .similarityScore(similarity)
                    .build();
        } catch (RuntimeException e) {
            log.warn("text comparison error", e);
            return ComparisonDetails.error("Comparison error: " + e.getMessage());
        }
    }

    String normalize(String text) {
        String normalized = text;
        if (!caseSensitive) {
            normalized = normalized.toLowerCase(Locale.ROOT);
        }
        if (ignoreTrailingWhitespace) {
            normalized = StrUtil.trimEnd(normalized);
        }
        if (normalizeWhitespace) {
            normalized = normalized.trim().replaceAll("\\s+", " ");
        }
        return normalized;
    }

    /**
     * 按行对比，不一致的行列出期望与实际
     */
    String diff(String expected, String actual) {
        String[] expectedLines = expected.split("\n", -1);
        String[] actualLines = actual.split("\n", -1);
        int maxLines = Math.max(expectedLines.length, actualLines.length);
        List<String> diffLines = new ArrayList<>();
        int differing = 0;
        for (int i = 0; i < maxLines; i++) {
            String expectedLine = i < expectedLines.length ? expectedLines[i] : "";
            String actualLine = i < actualLines.length ? actualLines[i] : "";
            if (expectedLine.equals(actualLine)) {
                continue;
            }
            differing++;
            if (diffLines.size() >= MAX_DIFF_LINES) {
                continue;
            }
            diffLines.add("Line " + (i + 1) + ":");
            diffLines.add("  Expected: " + quote(expectedLine));
            diffLines.add("  Actual:   " + quote(actualLine));
            if (expectedLine.length() < CHAR_DIFF_MAX_LENGTH && actualLine.length() < CHAR_DIFF_MAX_LENGTH) {
                diffLines.add("  Diff:     " + characterDiff(expectedLine, actualLine));
            }
        }
        if (diffLines.isEmpty()) {
            return "No differences found";
        }
        if (diffLines.size() >= MAX_DIFF_LINES) {
            diffLines.add(String.format("... (%d differing lines in total)", differing));
        }
        return String.join("\n", diffLines);
    }

    /**
     * 逐字符差异：[e→a] 替换，[-e] 缺失，[+a] 多余
     */
    static String characterDiff(String expected, String actual) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        int j = 0;
        while (i < expected.length() || j < actual.length()) {
            if (i < expected.length() && j < actual.length()) {
                char e = expected.charAt(i++);
                char a = actual.charAt(j++);
                if (e == a) {
                    sb.append(e);
                } else {
                    sb.append('[').append(e).append('→').append(a).append(']');
                }
            } else if (i < expected.length()) {
                sb.append("[-").append(expected.charAt(i++)).append(']');
            } else {
                sb.append("[+").append(actual.charAt(j++)).append(']');
            }
        }
        return sb.toString();
    }

    static double similarity(String expected, String actual) {
        if (expected.isEmpty() && actual.isEmpty()) {
            return 1.0;
        }
        if (expected.isEmpty() || actual.isEmpty()) {
            return 0.0;
        }
        int maxLength = Math.max(expected.length(), actual.length());
        if (maxLength > LEVENSHTEIN_MAX_LENGTH) {
            return lineMatchRatio(expected, actual);
        }
        int distance = StringUtils.getLevenshteinDistance(expected, actual);
        return Math.max(0.0, 1.0 - (double) distance / maxLength);
    }

    /**
     * 同一位置上相等的行数占比，空白已被合并时退化为按词比对
     */
    private static double lineMatchRatio(String expected, String actual) {
        String separator = expected.contains("\n") || actual.contains("\n") ? "\n" : "\\s+";
        String[] expectedLines = expected.split(separator);
        String[] actualLines = actual.split(separator);
        int maxLines = Math.max(expectedLines.length, actualLines.length);
        int common = Math.min(expectedLines.length, actualLines.length);
        int matched = 0;
        for (int i = 0; i < common; i++) {
            if (expectedLines[i].equals(actualLines[i])) {
                matched++;
            }
        }
        return (double) matched / maxLines;
    }

    private static String quote(String line) {
        return "'" + line.replace("\\", "\\\\").replace("\t", "\\t").replace("\r", "\\r").replace("'", "\\'") + "'";
    }

    @Override
    public String getName() {
        return NAME;
    }
}
