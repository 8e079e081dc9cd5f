package dev.plainsong.chord;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ChordGrammarTest {

    @Test
    void acceptsPlainAndQualifiedChords() {
        assertThat(ChordGrammar.isChord("C")).isTrue();
        assertThat(ChordGrammar.isChord("Am")).isTrue();
        assertThat(ChordGrammar.isChord("Cm7")).isTrue();
        assertThat(ChordGrammar.isChord("Bbmaj7")).isTrue();
        assertThat(ChordGrammar.isChord("F#m7b5")).isTrue();
        assertThat(ChordGrammar.isChord("Ddim")).isTrue();
        assertThat(ChordGrammar.isChord("CΔ7")).isTrue();
        assertThat(ChordGrammar.isChord("B°")).isTrue();
        assertThat(ChordGrammar.isChord("Eø7")).isTrue();
    }

    @Test
    void matchesEachExtensionIndependently() {
        assertThat(ChordGrammar.isChord("Csus4add9")).isTrue();
        assertThat(ChordGrammar.isChord("Asus2sus4")).isTrue();
        assertThat(ChordGrammar.isChord("Gsus")).isTrue();
        assertThat(ChordGrammar.isChord("E7b9")).isTrue();
        assertThat(ChordGrammar.isChord("C13")).isTrue();
    }

    @Test
    void acceptsAlterationsAndSlashBass() {
        assertThat(ChordGrammar.isChord("C/G")).isTrue();
        assertThat(ChordGrammar.isChord("D/F#")).isTrue();
        assertThat(ChordGrammar.isChord("Em7b9/Bb")).isTrue();
        assertThat(ChordGrammar.isChord("A7+")).isTrue();
        assertThat(ChordGrammar.isChord("Caug")).isTrue();
        assertThat(ChordGrammar.isChord("G7alt")).isTrue();
    }

    @Test
    void rejectsTokensOutsideTheGrammar() {
        assertThat(ChordGrammar.isChord("H")).isFalse();
        assertThat(ChordGrammar.isChord("Cx")).isFalse();
        assertThat(ChordGrammar.isChord("am")).isFalse();
        assertThat(ChordGrammar.isChord("Hello")).isFalse();
        assertThat(ChordGrammar.isChord("C/")).isFalse();
        assertThat(ChordGrammar.isChord("G/H")).isFalse();
        assertThat(ChordGrammar.isChord("C8")).isFalse();
        assertThat(ChordGrammar.isChord("Add")).isFalse();
    }

    @Test
    void requiresTheWholeTokenToMatch() {
        assertThat(ChordGrammar.isChord("xC")).isFalse();
        assertThat(ChordGrammar.isChord("Cm7,")).isFalse();
        assertThat(ChordGrammar.isChord(" C")).isFalse();
    }

    @Test
    void rejectsEmptyAndNullTokens() {
        assertThat(ChordGrammar.isChord("")).isFalse();
        assertThat(ChordGrammar.isChord(null)).isFalse();
    }

    @Test
    void handlesVeryLongChordLikeTokens() {
        String extensions = "7".repeat(100_000);

        assertThat(ChordGrammar.isChord("C" + extensions)).isTrue();
        assertThat(ChordGrammar.isChord("C" + extensions + "x")).isFalse();
        assertThat(ChordGrammar.isChord("Cm" + "sus4add9".repeat(20_000) + "/G")).isTrue();
    }

    @Test
    void extensionsDoNotSwallowAlterationsOrBass() {
        assertThat(ChordGrammar.isChord("C7b")).isTrue();
        assertThat(ChordGrammar.isChord("C9add")).isTrue();
        assertThat(ChordGrammar.isChord("C7aug")).isTrue();
        assertThat(ChordGrammar.isChord("Cadd9alt/E")).isTrue();
        assertThat(ChordGrammar.isChord("C113")).isFalse();
    }
}
