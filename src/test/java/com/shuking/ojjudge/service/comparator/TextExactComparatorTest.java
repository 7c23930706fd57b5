package com.shuking.ojjudge.service.comparator;

import com.shuking.ojjudge.model.ComparisonDetails;
import com.shuking.ojjudge.model.enums.ComparisonVerdict;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TextExactComparatorTest {

    private final TextExactComparator comparator = new TextExactComparator();

    @Test
    void extraSpacesAndTrailingNewlineStillMatch() {
        ComparisonDetails details = comparator.compare("hello world\nfoo", "hello   world \n foo\n\n");

        assertThat(details.getVerdict()).isEqualTo(ComparisonVerdict.MATCH);
        assertThat(details.getSimilarityScore()).isEqualTo(1.0);
    }

    @Test
    void mismatchCarriesLineAndCharacterDiff() {
        ComparisonDetails details = comparator.compare("abc\nxyz", "abd\nxyz");

        assertThat(details.getVerdict()).isEqualTo(ComparisonVerdict.MISMATCH);
        assertThat(details.getDiff())
                .contains("Line 1:")
                .contains("Expected: 'abc'")
                .contains("Actual:   'abd'")
                .contains("ab[c→d]")
                .doesNotContain("Line 2:");
        assertThat(details.getSimilarityScore()).isStrictlyBetween(0.0, 1.0);
    }

    @Test
    void characterDiffMarksMissingAndExtra() {
        assertThat(TextExactComparator.characterDiff("abc", "ab")).isEqualTo("ab[-c]");
        assertThat(TextExactComparator.characterDiff("ab", "abc")).isEqualTo("ab[+c]");
    }

    @Test
    void caseInsensitiveWhenConfigured() {
        TextExactComparator insensitive = new TextExactComparator(false, true, true);

        assertThat(insensitive.compare("YES", "yes").isMatch()).isTrue();
        assertThat(comparator.compare("YES", "yes").isMatch()).isFalse();
    }

    @Test
    void withoutNormalizationInnerWhitespaceMatters() {
        TextExactComparator strict = new TextExactComparator(true, false, true);

        assertThat(strict.compare("a b", "a  b").isMatch()).isFalse();
        assertThat(strict.compare("a b", "a b  \n").isMatch()).isTrue();
    }

    @Test
    void similarityFollowsEditDistance() {
        ComparisonDetails details = comparator.compare("abcd", "abcx");

        assertThat(details.getSimilarityScore()).isCloseTo(0.75, within(1e-9));
    }

    @Test
    void longTextsFallBackToPositionalMatch() {
        String expected = StringUtils.repeat("token ", 1000).trim();
        String actual = StringUtils.repeat("token ", 999) + "other";

        ComparisonDetails details = comparator.compare(expected, actual);

        assertThat(details.getVerdict()).isEqualTo(ComparisonVerdict.MISMATCH);
        assertThat(details.getSimilarityScore()).isCloseTo(0.999, within(1e-9));
    }

    @Test
    void emptyAgainstNonEmptyHasZeroSimilarity() {
        ComparisonDetails details = comparator.compare("", "something");

        assertThat(details.isMatch()).isFalse();
        assertThat(details.getSimilarityScore()).isZero();
    }
}
