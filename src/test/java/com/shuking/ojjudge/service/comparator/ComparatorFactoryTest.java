package com.shuking.ojjudge.service.comparator;

import com.shuking.ojjudge.model.enums.ComparisonType;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComparatorFactoryTest {

    @Test
    void createsByNameAndAlias() {
        assertThat(ComparatorFactory.create("exact", null)).isInstanceOf(TextExactComparator.class);
        assertThat(ComparatorFactory.create("TEXT", null)).isInstanceOf(TextExactComparator.class);
        assertThat(ComparatorFactory.create("numeric", null)).isInstanceOf(NumericComparator.class);
        assertThat(ComparatorFactory.create("json", null)).isInstanceOf(JsonComparator.class);
        assertThat(ComparatorFactory.create("array", null)).isInstanceOf(ArrayComparator.class);
    }

    @Test
    void unknownTypeIsRejected() {
        assertThatThrownBy(() -> ComparatorFactory.create("fuzzy", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown comparator type");
        assertThatThrownBy(() -> ComparatorFactory.create(ComparisonType.AUTO, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownConfigKeyIsRejected() {
        Map<String, Object> config = Collections.singletonMap("tolerance", 0.1);

        assertThatThrownBy(() -> ComparatorFactory.create(ComparisonType.NUMERIC, config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tolerance");
    }

    @Test
    void configIsApplied() {
        Map<String, Object> config = new HashMap<>();
        config.put("ignore_order", true);
        config.put("separator_pattern", ";");

        OutputComparator comparator = ComparatorFactory.create(ComparisonType.ARRAY, config);

        assertThat(comparator.compare("a;b;c", "c;a;b").isMatch()).isTrue();
        assertThat(ComparatorFactory.create(ComparisonType.EXACT, Collections.singletonMap("case_sensitive", "false"))
                .compare("ABC", "abc").isMatch()).isTrue();
        assertThat(ComparatorFactory.create(ComparisonType.NUMERIC, Collections.singletonMap("epsilon", 0.5))
                .compare("1.0", "1.4").isMatch()).isTrue();
    }

    @Test
    void invalidConfigValueIsRejected() {
        assertThatThrownBy(() -> ComparatorFactory.create(ComparisonType.NUMERIC, Collections.singletonMap("epsilon", "abc")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ComparatorFactory.create(ComparisonType.ARRAY, Collections.singletonMap("separator_pattern", "[")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void autoDetectPrefersArrayForBracketedPrimitiveLists() {
        assertThat(ComparatorFactory.autoDetect("[0,1]", "[0, 1]")).isInstanceOf(ArrayComparator.class);
        assertThat(ComparatorFactory.autoDetect("(1, 2)", "(1, 2)")).isInstanceOf(ArrayComparator.class);
        assertThat(ComparatorFactory.autoDetect("[a, b]", "[a, b]")).isInstanceOf(ArrayComparator.class);
    }

    @Test
    void autoDetectUsesJsonForStructuresAndScalars() {
        assertThat(ComparatorFactory.autoDetect("[{\"a\":1}]", "[{\"a\":1}]")).isInstanceOf(JsonComparator.class);
        assertThat(ComparatorFactory.autoDetect("{\"a\":1}", "{\"a\":2}")).isInstanceOf(JsonComparator.class);
        assertThat(ComparatorFactory.autoDetect("120", "0")).isInstanceOf(JsonComparator.class);
    }

    @Test
    void autoDetectUsesNumericForNumberSequences() {
        assertThat(ComparatorFactory.autoDetect("1 2 3", "1 2 4")).isInstanceOf(NumericComparator.class);
        assertThat(ComparatorFactory.autoDetect("1.5, 2.5", "1.5, 2.5")).isInstanceOf(NumericComparator.class);
    }

    @Test
    void autoDetectFallsBackToText() {
        assertThat(ComparatorFactory.autoDetect("hello world", "hello")).isInstanceOf(TextExactComparator.class);
        assertThat(ComparatorFactory.autoDetect("120", "")).isInstanceOf(TextExactComparator.class);
    }
}
