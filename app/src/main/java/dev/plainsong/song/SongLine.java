package dev.plainsong.song;

import java.util.List;
import java.util.Objects;

/**
 * A lyric line with the chords placed above it. Empty text denotes a chord-only line.
 */
public record SongLine(String text, List<SongChord> chords) {

    public SongLine {
        Objects.requireNonNull(text, "text");
        chords = chords == null ? List.of() : List.copyOf(chords);
    }

    public static SongLine chordsOnly(List<SongChord> chords) {
        return new SongLine("", chords);
    }

    public boolean hasChords() {
        return !chords.isEmpty();
    }

    public boolean isChordOnly() {
        return text.isEmpty();
    }
}
