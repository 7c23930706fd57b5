package com.shuking.ojjudge.service.comparator;

import cn.hutool.core.util.StrUtil;
import com.shuking.ojjudge.model.ComparisonDetails;
import com.shuking.ojjudge.model.enums.ComparisonVerdict;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 数值比较：按顺序抽取所有数字，绝对误差或相对误差在容差内即视为相等
 */
@Slf4j
public class NumericComparator implements OutputComparator {

    static final String NAME = "Numeric";

    private static final String SPECIAL = "(?<![A-Za-z])[-+]?(?:infinity|inf|nan)(?![A-Za-z])";

    private static final Pattern SCIENTIFIC_PATTERN = Pattern.compile(
            SPECIAL + "|[-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?", Pattern.CASE_INSENSITIVE);

    private static final Pattern PLAIN_PATTERN = Pattern.compile(
            SPECIAL + "|[-+]?(?:\\d+\\.?\\d*|\\.\\d+)", Pattern.CASE_INSENSITIVE);

    private static final double MIN_MAGNITUDE = 1e-10;

    private final double epsilon;

    private final double relativeTolerance;

    private final boolean allowScientificNotation;

    public NumericComparator() {
        this(1e-9, 1e-6, true);
    }

    public NumericComparator(double epsilon, double relativeTolerance, boolean allowScientificNotation) {
        this.epsilon = epsilon;
        this.relativeTolerance = relativeTolerance;
        this.allowScientificNotation = allowScientificNotation;
    }

    @Override
    public ComparisonDetails compare(String expected, String actual) {
        try {
            List<Double> expectedNumbers = extractNumbers(StrUtil.nullToEmpty(expected));
            List<Double> actualNumbers = extractNumbers(StrUtil.nullToEmpty(actual));
            if (expectedNumbers.size() != actualNumbers.size()) {
                return ComparisonDetails.builder()
                        .verdict(ComparisonVerdict.MISMATCH)
                        .message(String.format("Different number of numeric values: expected %d, got %d",
                                expectedNumbers.size(), actualNumbers.size()))
                        .diff(String.format("Expected: %s%nActual:   %s", expectedNumbers, actualNumbers))
                        .expectedParsed(expectedNumbers)
                        .actualParsed(actualNumbers)
                        .similarityScore(0.0)
                        .build();
            }

            StringBuilder diff = new StringBuilder();
            int mismatches = 0;
            double totalRelativeError = 0.0;
            for (int i = 0; i < expectedNumbers.size(); i++) {
                double e = expectedNumbers.get(i);
                double a = actualNumbers.get(i);
                if (numbersEqual(e, a)) {
                    continue;
                }
                mismatches++;
                double absoluteError = Math.abs(e - a);
                double relativeError = relativeError(e, a);
                totalRelativeError += relativeError;
                if (diff.length() > 0) {
                    diff.append('\n');
                }
                diff.append(String.format(Locale.ROOT, "Value %d:%n  Expected: %s%n  Actual:   %s%n  Abs Error: %.2e%n  Rel Error: %.2f%%",
                        i, e, a, absoluteError, relativeError * 100));
            }
            if (mismatches == 0) {
                return ComparisonDetails.builder()
                        .verdict(ComparisonVerdict.MATCH)
                        .message("All numeric values match within tolerance")
                        .expectedParsed(expectedNumbers)
                        .actualParsed(actualNumbers)
                        .similarityScore(1.0)
                        .build();
            }
            double meanRelativeError = totalRelativeError / expectedNumbers.size();
            double similarity = Math.max(0.0, Math.min(1.0, 1.0 - meanRelativeError));
            return ComparisonDetails.builder()
                    .verdict(ComparisonVerdict.MISMATCH)
                    .message(String.format(Locale.ROOT, "%d numeric mismatches (mean relative error: %.2e)", mismatches, meanRelativeError))
                    .diff(diff.toString())
                    .expectedParsed(expectedNumbers)
                    .actualParsed(actualNumbers)
                    .similarityScore(similarity)
                    .build();
        } catch (RuntimeException e) {
            log.warn("numeric comparison error", e);
            return ComparisonDetails.error("Numeric comparison error: " + e.getMessage());
        }
    }

    /**
     * 按出现顺序抽取数字，支持 nan、inf、infinity
     */
    List<Double> extractNumbers(String text) {
        Matcher matcher = (allowScientificNotation ? SCIENTIFIC_PATTERN : PLAIN_PATTERN).matcher(text);
        List<Double> numbers = new ArrayList<>();
        while (matcher.find()) {
            numbers.add(parseNumber(matcher.group()));
        }
        return numbers;
    }

    static double parseNumber(String token) {
        String lower = token.toLowerCase(Locale.ROOT);
        boolean negative = lower.startsWith("-");
        String unsigned = lower.startsWith("-") || lower.startsWith("+") ? lower.substring(1) : lower;
        if ("nan".equals(unsigned)) {
            return Double.NaN;
        }
        if ("inf".equals(unsigned) || "infinity".equals(unsigned)) {
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return Double.parseDouble(lower);
    }

    boolean numbersEqual(double a, double b) {
        if (Double.isNaN(a) || Double.isNaN(b)) {
            return Double.isNaN(a) && Double.isNaN(b);
        }
        if (Double.isInfinite(a) || Double.isInfinite(b)) {
            return a == b;
        }
        double difference = Math.abs(a - b);
        if (difference <= epsilon) {
            return true;
        }
        double magnitude = Math.max(Math.abs(a), Math.abs(b));
        return magnitude > 0 && difference / magnitude <= relativeTolerance;
    }

    /**
     * 不一致的一对数字的相对误差，无法计算时记为 1
     */
    private static double relativeError(double e, double a) {
        double error = Math.abs(e - a) / Math.max(Math.max(Math.abs(e), Math.abs(a)), MIN_MAGNITUDE);
        if (Double.isNaN(error) || Double.isInfinite(error)) {
            return 1.0;
        }
        return Math.min(1.0, error);
    }

    @Override
    public String getName() {
        return NAME;
    }
}
