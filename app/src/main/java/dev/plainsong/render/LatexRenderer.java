package dev.plainsong.render;

import dev.plainsong.song.Song;
import dev.plainsong.song.SongChord;
import dev.plainsong.song.SongLine;
import dev.plainsong.song.SongPart;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Renders songs with the macros of the LaTeX {@code songs} package.
 *
 * <p>Chords are inlined as {@code \[name]} markers at their offsets. Markers are inserted from the
 * rightmost offset to the leftmost so that an insertion never shifts an offset still to be used.
 * Offsets are code point indices, so characters outside the BMP are never split.
 */
public class LatexRenderer implements SongRenderer {

    private static final String CHORUS = "chorus";
    private static final Pattern NUMBERED_VERSE = Pattern.compile("verse \\d+");
    private static final String INDENT = "\t";

    @Override
    public String render(Song song) {
        Objects.requireNonNull(song, "song");
        StringBuilder out = new StringBuilder();
        out.append("\\beginsong{").append(song.title()).append('}');
        song.artist().ifPresent(artist -> out.append("[by={").append(artist).append("}]"));
        out.append("\n\n");

        for (SongPart part : song.parts()) {
            out.append(renderPart(part)).append('\n');
        }

        out.append("\\endsong\n");
        return out.toString();
    }

    public String renderPart(SongPart part) {
        String kind = part.name().toLowerCase(Locale.ROOT);
        StringBuilder out = new StringBuilder();
        String end;
        if (kind.equals(CHORUS)) {
            out.append("\\beginchorus\n");
            end = "\\endchorus\n";
        } else if (NUMBERED_VERSE.matcher(kind).matches()) {
            out.append("\\beginverse\n");
            end = "\\endverse\n";
        } else {
            out.append("\\beginverse*\n");
            out.append(INDENT).append("\\textbf{").append(part.name()).append(":}\n");
            end = "\\endverse\n";
        }

        for (SongLine line : part.lines()) {
            out.append(INDENT).append(renderLine(line));
        }

        out.append(end);
        return out.toString();
    }

    public String renderLine(SongLine line) {
        if (!line.hasChords()) {
            return line.text() + "\n";
        }

        List<SongChord> descending = new ArrayList<>(line.chords());
        descending.sort(Comparator.comparingInt(SongChord::offset).reversed());

        StringBuilder out = new StringBuilder(line.text());
        int length = out.codePointCount(0, out.length());
        int rightmost = descending.get(0).offset();
        if (rightmost > length) {
            out.append(" ".repeat(rightmost - length));
        }
        for (SongChord chord : descending) {
            out.insert(out.offsetByCodePoints(0, chord.offset()), "\\[" + chord.name() + "]");
        }

        if (line.isChordOnly()) {
            return "\\nolyrics{" + out + "}\n";
        }
        return out.append('\n').toString();
    }
}
