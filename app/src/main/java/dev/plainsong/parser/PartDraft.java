package dev.plainsong.parser;

import dev.plainsong.song.SongLine;
import dev.plainsong.song.SongPart;
import java.util.ArrayList;
import java.util.List;

/**
 * Part under construction. It is only appended to the song once a blank line closes it.
 */
final class PartDraft {

    private String name = "";
    private final List<SongLine> lines = new ArrayList<>();

    String name() {
        return name;
    }

    void name(String name) {
        this.name = name;
    }

    void addLine(SongLine line) {
        lines.add(line);
    }

    int lineCount() {
        return lines.size();
    }

    /**
     * A draft is present once it has a name or at least one line.
     */
    boolean isPresent() {
        return !name.isEmpty() || !lines.isEmpty();
    }

    SongPart toPart() {
        return new SongPart(name, lines);
    }
}
