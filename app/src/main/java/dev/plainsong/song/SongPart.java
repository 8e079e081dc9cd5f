package dev.plainsong.song;

import java.util.List;
import java.util.Objects;

/**
 * A named section of a song. An empty name means no part header was seen.
 */
public record SongPart(String name, List<SongLine> lines) {

    public SongPart {
        Objects.requireNonNull(name, "name");
        lines = lines == null ? List.of() : List.copyOf(lines);
    }
}
