package dev.plainsong.chord;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import dev.plainsong.song.SongChord;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ChordLineExtractorTest {

    private final ChordLineExtractor extractor = new ChordLineExtractor();

    @Test
    void recordsTheStartOffsetOfEveryChord() {
        Optional<List<SongChord>> chords = extractor.extract("G       D");

        assertThat(chords).isPresent();
        assertThat(chords.get())
                .extracting(SongChord::name, SongChord::offset)
                .containsExactly(tuple("G", 0), tuple("D", 8));
    }

    @Test
    void countsLeadingAndRepeatedSpaces() {
        Optional<List<SongChord>> chords = extractor.extract("  Am   C/G ");

        assertThat(chords).isPresent();
        assertThat(chords.get())
                .extracting(SongChord::name, SongChord::offset)
                .containsExactly(tuple("Am", 2), tuple("C/G", 7));
    }

    @Test
    void rejectsLyricLines() {
        assertThat(extractor.extract("Hello world")).isEmpty();
    }

    @Test
    void rejectsTheWholeLineWhenOneTokenIsNotAChord() {
        assertThat(extractor.extract("G D Hello")).isEmpty();
        assertThat(extractor.extract("Hello G D")).isEmpty();
    }

    @Test
    void treatsTabsAsTokenCharacters() {
        assertThat(extractor.extract("G\tD")).isEmpty();
    }

    @Test
    void emptyOrSpaceOnlyLinesYieldNoChords() {
        assertThat(extractor.extract("")).contains(List.of());
        assertThat(extractor.extract("    ")).contains(List.of());
    }

    @Test
    void offsetsFollowTokenOrder() {
        List<SongChord> chords = extractor.extract("C G Am F  C/E Dm7 G7sus4").orElseThrow();

        assertThat(chords).extracting(SongChord::offset).isSorted();
        assertThat(chords)
                .extracting(SongChord::name, SongChord::offset)
                .containsExactly(
                        tuple("C", 0),
                        tuple("G", 2),
                        tuple("Am", 4),
                        tuple("F", 7),
                        tuple("C/E", 10),
                        tuple("Dm7", 14),
                        tuple("G7sus4", 18));
    }
}
