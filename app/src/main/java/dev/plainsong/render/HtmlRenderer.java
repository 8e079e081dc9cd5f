package dev.plainsong.render;

import dev.plainsong.song.Song;
import dev.plainsong.song.SongChord;
import dev.plainsong.song.SongLine;
import dev.plainsong.song.SongPart;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a song as preformatted HTML with chords in bold on their own line above the lyrics.
 */
public class HtmlRenderer implements SongRenderer {

    @Override
    public String render(Song song) {
        Objects.requireNonNull(song, "song");
        StringBuilder out = new StringBuilder("<pre>");
        out.append("<h1>").append(song.title()).append("</h1>\n");
        for (Map.Entry<String, String> entry : song.metadata().entrySet()) {
            out.append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
        }
        out.append("\n\n");

        for (SongPart part : song.parts()) {
            renderPart(part, out);
            out.append("\n\n");
        }

        out.append("</pre>");
        return out.toString();
    }

    private void renderPart(SongPart part, StringBuilder out) {
        out.append("<em>").append(part.name()).append(":</em>\n");
        for (SongLine line : part.lines()) {
            renderLine(line, out);
        }
    }

    private void renderLine(SongLine line, StringBuilder out) {
        if (line.hasChords()) {
            out.append("<b>");
            int column = 0;
            for (SongChord chord : line.chords()) {
                // Chords closer than the previous name's width are separated by nothing.
                out.append(" ".repeat(Math.max(0, chord.offset() - column)));
                out.append(chord.name());
                column = Math.max(column, chord.offset()) + chord.name().length();
            }
            out.append("</b>\n");
        }
        if (!line.isChordOnly()) {
            out.append(line.text()).append('\n');
        }
    }
}
