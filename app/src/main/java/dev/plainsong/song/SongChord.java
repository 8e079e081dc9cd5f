package dev.plainsong.song;

import java.util.Objects;

/**
 * A chord sounded at a character offset of its owning line.
 *
 * <p>The offset may lie past the end of the line text; such chords overhang the lyrics.
 */
public record SongChord(String name, int offset) {

    public SongChord {
        Objects.requireNonNull(name, "name");
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be zero or greater");
        }
    }
}
