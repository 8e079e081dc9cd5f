package dev.plainsong.parser;

import dev.plainsong.chord.ChordLineExtractor;
import dev.plainsong.song.Song;
import dev.plainsong.song.SongChord;
import dev.plainsong.song.SongLine;
import dev.plainsong.song.SongPart;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a plain "chords over lyrics" song sheet into a {@link Song}.
 *
 * <p>The first non-blank line is the title. It is followed by {@code key: value} metadata lines
 * and then by the body, where blank lines separate parts and a part may open with a
 * {@code Name:} header. A chord line is attached to the lyric line that follows it; a chord line
 * with no lyric line after it becomes a chord-only line.
 *
 * <p>Parsing never fails: a line that is not recognised as anything else is kept as lyrics.
 */
public class SongParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(SongParser.class);

    // Greedy key: the last ": " in the line separates key from value.
    private static final Pattern METADATA = Pattern.compile("^\\s*(.*): (.*)\\s*$");
    private static final Pattern PART_HEADER = Pattern.compile("^\\s*(.*):$");

    private final ChordLineExtractor chordLineExtractor;

    public SongParser() {
        this(new ChordLineExtractor());
    }

    public SongParser(ChordLineExtractor chordLineExtractor) {
        this.chordLineExtractor = Objects.requireNonNull(chordLineExtractor, "chordLineExtractor");
    }

    public Song parse(String content) {
        Objects.requireNonNull(content, "content");
        Session session = new Session();
        ParserState state = ParserState.START;
        List<String> lines = content.lines().collect(Collectors.toList());
        for (String line : lines) {
            state = session.step(state, line);
        }
        // A trailing blank line flushes the last part like any other boundary.
        session.step(state, "");

        Song song = session.toSong();
        LOGGER.debug("Parsed '{}' with {} metadata entries and {} parts",
                song.title(), song.metadata().size(), song.parts().size());
        return song;
    }

    /**
     * Trims Unicode white space, including the no-break spaces that {@link String#strip()} keeps.
     */
    static String trim(String line) {
        int start = 0;
        int end = line.length();
        while (start < end) {
            int codePoint = line.codePointAt(start);
            if (!isWhiteSpace(codePoint)) {
                break;
            }
            start += Character.charCount(codePoint);
        }
        while (end > start) {
            int codePoint = line.codePointBefore(end);
            if (!isWhiteSpace(codePoint)) {
                break;
            }
            end -= Character.charCount(codePoint);
        }
        return line.substring(start, end);
    }

    private static boolean isWhiteSpace(int codePoint) {
        return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint) || codePoint == '\u0085';
    }

    private final class Session {

        private String title = "";
        private final Map<String, String> metadata = new LinkedHashMap<>();
        private final List<SongPart> parts = new ArrayList<>();
        private PartDraft part = new PartDraft();
        private List<SongChord> pendingChords = List.of();

        ParserState step(ParserState state, String line) {
            String trimmed = trim(line);
            boolean blank = trimmed.isEmpty();
            return switch (state) {
                case START -> {
                    if (blank) {
                        yield ParserState.START;
                    }
                    title = trimmed;
                    yield ParserState.DEFINITION;
                }
                case DEFINITION -> {
                    if (blank || readMetadata(line)) {
                        yield ParserState.DEFINITION;
                    }
                    yield step(ParserState.BODY, line);
                }
                case BODY -> {
                    if (blank) {
                        closePart();
                    } else {
                        readBodyLine(line);
                    }
                    yield ParserState.BODY;
                }
            };
        }

        private boolean readMetadata(String line) {
            Matcher matcher = METADATA.matcher(line);
            if (!matcher.matches()) {
                return false;
            }
            metadata.put(matcher.group(1), matcher.group(2));
            return true;
        }

        private void closePart() {
            if (!part.isPresent()) {
                return;
            }
            if (!pendingChords.isEmpty()) {
                part.addLine(SongLine.chordsOnly(pendingChords));
                pendingChords = List.of();
            }
            LOGGER.debug("Closing part '{}' with {} lines", part.name(), part.lineCount());
            parts.add(part.toPart());
            part = new PartDraft();
        }

        private void readBodyLine(String line) {
            if (!part.isPresent()) {
                Matcher header = PART_HEADER.matcher(line);
                if (header.matches()) {
                    part.name(header.group(1));
                    return;
                }
            }

            Optional<List<SongChord>> chords = chordLineExtractor.extract(line);
            if (chords.isPresent()) {
                List<SongChord> previous = pendingChords;
                pendingChords = chords.get();
                // Two chord lines in a row: the first one stands on its own.
                if (!previous.isEmpty()) {
                    part.addLine(SongLine.chordsOnly(previous));
                }
                return;
            }

            part.addLine(new SongLine(line, pendingChords));
            pendingChords = List.of();
        }

        Song toSong() {
            return new Song(title, metadata, parts);
        }
    }
}
