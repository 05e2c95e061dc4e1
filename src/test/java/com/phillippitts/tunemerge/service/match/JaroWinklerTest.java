package com.phillippitts.tunemerge.service.match;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class JaroWinklerTest {

    @Test
    void equalStringsScoreOne() {
        assertThat(JaroWinkler.similarity("abbey road", "abbey road")).isEqualTo(1.0);
        assertThat(JaroWinkler.similarity("", "")).isEqualTo(1.0);
    }

    @Test
    void emptyAgainstNonEmptyScoresZero() {
        assertThat(JaroWinkler.similarity("", "abc")).isEqualTo(0.0);
        assertThat(JaroWinkler.similarity("abc", "")).isEqualTo(0.0);
    }

    @Test
    void matchesTextbookValues() {
        assertThat(JaroWinkler.jaro("MARTHA", "MARHTA")).isCloseTo(0.944, within(0.001));
        assertThat(JaroWinkler.similarity("MARTHA", "MARHTA")).isCloseTo(0.961, within(0.001));
        assertThat(JaroWinkler.similarity("DWAYNE", "DUANE")).isCloseTo(0.840, within(0.001));
    }

    @Test
    void noCommonCharactersScoresZero() {
        assertThat(JaroWinkler.similarity("abc", "xyz")).isEqualTo(0.0);
    }
}
