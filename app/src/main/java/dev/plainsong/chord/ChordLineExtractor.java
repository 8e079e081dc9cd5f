package dev.plainsong.chord;

import dev.plainsong.song.SongChord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Splits a raw line on ASCII spaces and keeps each token with the offset it starts at.
 *
 * <p>Offsets are code point indices. A line is a chord line only when every token is a chord.
 * Tabs and other whitespace are ordinary token characters. A line made only of spaces yields an
 * empty chord list.
 */
public class ChordLineExtractor {

    private static final char SEPARATOR = ' ';

    public Optional<List<SongChord>> extract(String line) {
        Objects.requireNonNull(line, "line");

        List<SongChord> chords = new ArrayList<>();
        StringBuilder token = new StringBuilder();
        int tokenStart = 0;

        int position = 0;
        for (int index = 0; index < line.length(); position++) {
            int codePoint = line.codePointAt(index);
            index += Character.charCount(codePoint);
            if (codePoint != SEPARATOR) {
                token.appendCodePoint(codePoint);
                continue;
            }
            if (token.length() > 0) {
                if (!accept(token, tokenStart, chords)) {
                    return Optional.empty();
                }
                token.setLength(0);
            }
            tokenStart = position + 1;
        }

        if (token.length() > 0 && !accept(token, tokenStart, chords)) {
            return Optional.empty();
        }
        return Optional.of(chords);
    }

    private boolean accept(CharSequence token, int start, List<SongChord> chords) {
        String name = token.toString();
        if (!ChordGrammar.isChord(name)) {
            return false;
        }
        chords.add(new SongChord(name, start));
        return true;
    }
}
