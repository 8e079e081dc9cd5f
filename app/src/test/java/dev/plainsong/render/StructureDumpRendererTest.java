package dev.plainsong.render;

import static org.assertj.core.api.Assertions.assertThat;

import dev.plainsong.song.Song;
import dev.plainsong.song.SongChord;
import dev.plainsong.song.SongLine;
import dev.plainsong.song.SongPart;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StructureDumpRendererTest {

    private final StructureDumpRenderer renderer = new StructureDumpRenderer();

    @Test
    void dumpsEmptySong() {
        assertThat(renderer.render(new Song("T", Map.of(), List.of())))
                .isEqualTo("Song {\n    title: \"T\",\n    metadata: {},\n    parts: [],\n}");
    }

    @Test
    void dumpsNestedTree() {
        Song song = new Song("T", Map.of("a", "b"), List.of(
                new SongPart("P", List.of(new SongLine("x", List.of(new SongChord("C", 0)))))));

        assertThat(renderer.render(song)).isEqualTo("""
                Song {
                    title: "T",
                    metadata: {
                        "a": "b",
                    },
                    parts: [
                        SongPart {
                            name: "P",
                            lines: [
                                SongLine {
                                    text: "x",
                                    chords: [
                                        SongChord {
                                            name: "C",
                                            pos: 0,
                                        },
                                    ],
                                },
                            ],
                        },
                    ],
                }""");
    }

    @Test
    void escapesQuotesAndBackslashes() {
        assertThat(StructureDumpRenderer.quote("say \"hi\" \\ bye")).isEqualTo("\"say \\\"hi\\\" \\\\ bye\"");
    }
}
