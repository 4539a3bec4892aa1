package io.sagescan.aggregate;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SequenceMatcherTest {

    @Test
    void ratio_isOneForIdenticalAndEmptyStrings() {
        assertThat(SequenceMatcher.ratio("same text", "same text")).isEqualTo(1.0);
        assertThat(SequenceMatcher.ratio("", "")).isEqualTo(1.0);
    }

    @Test
    void ratio_isZeroWithoutCommonCharacters() {
        assertThat(SequenceMatcher.ratio("abc", "xyz")).isEqualTo(0.0);
        assertThat(SequenceMatcher.ratio("abc", "")).isEqualTo(0.0);
    }

    @Test
    void ratio_countsLongestBlockThenRecurses() {
        assertThat(SequenceMatcher.ratio("abcd", "bcde")).isCloseTo(0.75, within(1e-9));
    }

    @Test
    void ratio_isOrderSensitiveLikeRatcliffObershelp() {
        assertThat(SequenceMatcher.ratio("tide", "diet")).isCloseTo(0.25, within(1e-9));
        assertThat(SequenceMatcher.ratio("diet", "tide")).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void longestMatch_prefersEarliestBlock() {
        int[] match = SequenceMatcher.longestMatch("abxab", 0, 5, "ab", 0, 2, Set.of());

        assertThat(match).containsExactly(0, 0, 2);
    }

    @Test
    void ratio_popularCharactersOfLongTextCannotSeedMatches() {
        String a = "b" + "a".repeat(199);
        String b = "a".repeat(199) + "b";

        assertThat(SequenceMatcher.popularCharacters(b)).containsExactly('a');
        assertThat(SequenceMatcher.ratio(a, b)).isCloseTo(0.005, within(1e-9));
        assertThat(SequenceMatcher.ratio("xyz" + "a".repeat(150), "a".repeat(199) + "xyz"))
                .isCloseTo(6.0 / 355, within(1e-9));
    }

    @Test
    void ratio_popularCharactersStillExtendAMatch() {
        assertThat(SequenceMatcher.ratio("a".repeat(200), "a".repeat(200))).isEqualTo(1.0);
        assertThat(SequenceMatcher.ratio("a".repeat(199) + "b", "a".repeat(199) + "b")).isEqualTo(1.0);
    }

    @Test
    void ratio_shortTextHasNoPopularCharacters() {
        assertThat(SequenceMatcher.popularCharacters("a".repeat(199))).isEmpty();
        assertThat(SequenceMatcher.ratio("aab", "a".repeat(100))).isCloseTo(4.0 / 103, within(1e-9));
    }
}
