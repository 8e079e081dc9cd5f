package dev.plainsong.song;

import dev.plainsong.render.HtmlRenderer;
import dev.plainsong.render.LatexRenderer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed song sheet: title, header metadata and the ordered parts of the body.
 */
public record Song(String title, Map<String, String> metadata, List<SongPart> parts) {

    public static final String ARTIST_KEY = "artist";

    public Song {
        Objects.requireNonNull(title, "title");
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        parts = parts == null ? List.of() : List.copyOf(parts);
    }

    public Optional<String> artist() {
        return Optional.ofNullable(metadata.get(ARTIST_KEY));
    }

    public String toLatex() {
        return new LatexRenderer().render(this);
    }

    public String toHtml() {
        return new HtmlRenderer().render(this);
    }
}
