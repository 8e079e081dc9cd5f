package dev.plainsong.render;

import dev.plainsong.song.Song;

/**
 * Produces a textual rendition of a fully parsed song.
 */
public interface SongRenderer {

    String render(Song song);
}
