package dev.plainsong.render;

import dev.plainsong.song.Song;
import dev.plainsong.song.SongChord;
import dev.plainsong.song.SongLine;
import dev.plainsong.song.SongPart;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Debug dump of the parsed tree in an indented, RON-like notation.
 */
public class StructureDumpRenderer implements SongRenderer {

    private static final String INDENT = "    ";

    @FunctionalInterface
    private interface ElementWriter<T> {
        void write(StringBuilder out, T element, int depth);
    }

    @Override
    public String render(Song song) {
        Objects.requireNonNull(song, "song");
        StringBuilder out = new StringBuilder("Song {\n");
        field(out, 1, "title").append(quote(song.title())).append(",\n");
        field(out, 1, "metadata");
        if (song.metadata().isEmpty()) {
            out.append("{},\n");
        } else {
            out.append("{\n");
            for (Map.Entry<String, String> entry : song.metadata().entrySet()) {
                indent(out, 2).append(quote(entry.getKey())).append(": ")
                        .append(quote(entry.getValue())).append(",\n");
            }
            indent(out, 1).append("},\n");
        }
        field(out, 1, "parts");
        list(out, 1, song.parts(), StructureDumpRenderer::part);
        return out.append(",\n}").toString();
    }

    private static void part(StringBuilder out, SongPart part, int depth) {
        out.append("SongPart {\n");
        field(out, depth + 1, "name").append(quote(part.name())).append(",\n");
        field(out, depth + 1, "lines");
        list(out, depth + 1, part.lines(), StructureDumpRenderer::line);
        out.append(",\n");
        indent(out, depth).append('}');
    }

    private static void line(StringBuilder out, SongLine line, int depth) {
        out.append("SongLine {\n");
        field(out, depth + 1, "text").append(quote(line.text())).append(",\n");
        field(out, depth + 1, "chords");
        list(out, depth + 1, line.chords(), StructureDumpRenderer::chord);
        out.append(",\n");
        indent(out, depth).append('}');
    }

    private static void chord(StringBuilder out, SongChord chord, int depth) {
        out.append("SongChord {\n");
        field(out, depth + 1, "name").append(quote(chord.name())).append(",\n");
        field(out, depth + 1, "pos").append(chord.offset()).append(",\n");
        indent(out, depth).append('}');
    }

    private static <T> void list(StringBuilder out, int depth, List<T> elements, ElementWriter<T> writer) {
        if (elements.isEmpty()) {
            out.append("[]");
            return;
        }
        out.append("[\n");
        for (T element : elements) {
            indent(out, depth + 1);
            writer.write(out, element, depth + 1);
            out.append(",\n");
        }
        indent(out, depth).append(']');
    }

    private static StringBuilder field(StringBuilder out, int depth, String name) {
        return indent(out, depth).append(name).append(": ");
    }

    private static StringBuilder indent(StringBuilder out, int depth) {
        return out.append(INDENT.repeat(depth));
    }

    static String quote(String value) {
        StringBuilder quoted = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\\' -> quoted.append("\\\\");
                case '"' -> quoted.append("\\\"");
                case '\t' -> quoted.append("\\t");
                default -> quoted.append(ch);
            }
        }
        return quoted.append('"').toString();
    }
}
