package com.shuking.ojjudge.service.comparator;

import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import com.shuking.ojjudge.model.ComparisonDetails;
import com.shuking.ojjudge.model.enums.ComparisonVerdict;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * JSON 结构比较，数组可忽略顺序，数字不区分整数与小数
 */
@Slf4j
public class JsonComparator implements OutputComparator {

    static final String NAME = "JSON";

    private static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    private final boolean ignoreOrder;

    private final boolean ignoreExtraFields;

    private final double numericTolerance;

    public JsonComparator() {
        this(true, false, 1e-9);
    }

    public JsonComparator(boolean ignoreOrder, boolean ignoreExtraFields, double numericTolerance) {
        this.ignoreOrder = ignoreOrder;
        this.ignoreExtraFields = ignoreExtraFields;
        this.numericTolerance = numericTolerance;
    }

    /**
     * 解析 JSON 文本，空文本与多余内容都视为解析失败
     *
     * @param text 文本
     * @return 树
     * @throws JsonProcessingException 解析失败
     */
    static JsonNode parse(String text) throws JsonProcessingException {
        JsonNode node = OBJECT_MAPPER.readTree(StrUtil.nullToEmpty(text).trim());
        if (node == null || node.isMissingNode()) {
            throw new JsonParseFailure("No content to parse");
        }
        return node;
    }

    /**
     * 能否解析为 JSON
     */
    static JsonNode tryParse(String text) {
        try {
            return parse(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    @Override
    public ComparisonDetails compare(String expected, String actual) {
        JsonNode expectedNode;
        JsonNode actualNode;
        try {
            expectedNode = parse(expected);
            actualNode = parse(actual);
        } catch (JsonProcessingException e) {
            return ComparisonDetails.error("JSON parsing error: " + e.getOriginalMessage());
        }
        try {
            List<String> differences = new ArrayList<>();
            compareNode(expectedNode, actualNode, "", differences);
            if (differences.isEmpty()) {
                return ComparisonDetails.builder()
                        .verdict(ComparisonVerdict.MATCH)
                        .message("JSON structures match")
                        .expectedParsed(expectedNode)
                        .actualParsed(actualNode)
                        .similarityScore(1.0)
                        .build();
            }
            double similarity = Math.max(0.0, 1.0 - Math.min(1.0, differences.size() / 10.0));
            return ComparisonDetails.builder()
                    .verdict(ComparisonVerdict.MISMATCH)
                    .message(String.format("%d JSON differences found", differences.size()))
                    .diff(String.join("\n", differences))
                    .expectedParsed(expectedNode)
                    .actualParsed(actualNode)
                    .similarityScore(similarity)
                    .build();
        } catch (RuntimeException e) {
            log.warn("json comparison error", e);
            return ComparisonDetails.error("JSON comparison error: " + e.getMessage());
        }
    }

    private void compareNode(JsonNode expected, JsonNode actual, String path, List<String> differences) {
        JsonNodeType expectedType = expected.getNodeType();
        JsonNodeType actualType = actual.getNodeType();
        if (expectedType != actualType) {
            differences.add(String.format("%s: Type mismatch - expected %s, got %s",
                    label(path), typeName(expectedType), typeName(actualType)));
            return;
        }
        switch (expectedType) {
            case OBJECT:
                compareObjects(expected, actual, path, differences);
                break;
            case ARRAY:
                compareArrays(expected, actual, path, differences);
                break;
            case NUMBER:
                if (!numbersEqual(expected, actual)) {
                    differences.add(String.format("%s: Numeric mismatch - expected %s, got %s",
                            label(path), expected.asText(), actual.asText()));
                }
                break;
            default:
                if (!expected.equals(actual)) {
                    differences.add(String.format("%s: Value mismatch - expected %s, got %s",
                            label(path), expected, actual));
                }
        }
    }

    private void compareObjects(JsonNode expected, JsonNode actual, String path, List<String> differences) {
        TreeSet<String> expectedKeys = fieldNames(expected);
        TreeSet<String> actualKeys = fieldNames(actual);
        if (!ignoreExtraFields) {
            TreeSet<String> extraKeys = new TreeSet<>(actualKeys);
            extraKeys.removeAll(expectedKeys);
            if (!extraKeys.isEmpty()) {
                differences.add(String.format("%s: Extra keys in actual: %s", label(path), extraKeys));
            }
        }
        TreeSet<String> missingKeys = new TreeSet<>(expectedKeys);
        missingKeys.removeAll(actualKeys);
        if (!missingKeys.isEmpty()) {
            differences.add(String.format("%s: Missing keys in actual: %s", label(path), missingKeys));
        }
        Iterator<String> iterator = expected.fieldNames();
        while (iterator.hasNext()) {
            String key = iterator.next();
            if (actual.has(key)) {
                String childPath = path.isEmpty() ? key : path + "." + key;
                compareNode(expected.get(key), actual.get(key), childPath, differences);
            }
        }
    }

    private void compareArrays(JsonNode expected, JsonNode actual, String path, List<String> differences) {
        if (expected.size() != actual.size()) {
            differences.add(String.format("%s: Length mismatch - expected %d, got %d", label(path), expected.size(), actual.size()));
            return;
        }
        if (!ignoreOrder) {
            for (int i = 0; i < expected.size(); i++) {
                compareNode(expected.get(i), actual.get(i), path + "[" + i + "]", differences);
            }
            return;
        }
        // 按规范化字符串排序后逐个比较
        List<JsonNode> expectedSorted = sortedElements(expected);
        List<JsonNode> actualSorted = sortedElements(actual);
        for (int i = 0; i < expectedSorted.size(); i++) {
            compareNode(expectedSorted.get(i), actualSorted.get(i), path + "[" + i + "] (sorted)", differences);
        }
    }

    private boolean numbersEqual(JsonNode expected, JsonNode actual) {
        if (expected.isIntegralNumber() && actual.isIntegralNumber()) {
            return expected.bigIntegerValue().equals(actual.bigIntegerValue());
        }
        double e = expected.doubleValue();
        double a = actual.doubleValue();
        if (Double.isNaN(e) || Double.isNaN(a)) {
            return Double.isNaN(e) && Double.isNaN(a);
        }
        if (Double.isInfinite(e) || Double.isInfinite(a)) {
            return e == a;
        }
        return Math.abs(e - a) <= numericTolerance;
    }

    private static List<JsonNode> sortedElements(JsonNode array) {
        List<JsonNode> elements = new ArrayList<>();
        array.forEach(elements::add);
        elements.sort(Comparator.comparing(JsonComparator::canonical));
        return elements;
    }

    private static TreeSet<String> fieldNames(JsonNode node) {
        TreeSet<String> names = new TreeSet<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    /**
     * 键有序、数字统一表示的字符串形式，用作无序比较时的排序键
     */
    static String canonical(JsonNode node) {
        StringBuilder sb = new StringBuilder();
        appendCanonical(node, sb);
        return sb.toString();
    }

    private static void appendCanonical(JsonNode node, StringBuilder sb) {
        if (node.isObject()) {
            sb.append('{');
            boolean first = true;
            for (String key : fieldNames(node)) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                sb.append('"').append(key).append("\":");
                appendCanonical(node.get(key), sb);
            }
            sb.append('}');
        } else if (node.isArray()) {
            sb.append('[');
            for (int i = 0; i < node.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                appendCanonical(node.get(i), sb);
            }
            sb.append(']');
        } else if (node.isIntegralNumber()) {
            sb.append(node.bigIntegerValue());
        } else if (node.isNumber()) {
            double value = node.doubleValue();
            if (!Double.isInfinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15) {
                sb.append((long) value);
            } else {
                sb.append(value);
            }
        } else {
            sb.append(node);
        }
    }

    private static String label(String path) {
        return path.isEmpty() ? "$" : path;
    }

    private static String typeName(JsonNodeType type) {
        return type.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * 空文本的解析失败
     */
    private static final class JsonParseFailure extends JsonProcessingException {

        private JsonParseFailure(String message) {
            super(message);
        }
    }
}
