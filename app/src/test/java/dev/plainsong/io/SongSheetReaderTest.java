package dev.plainsong.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SongSheetReaderTest {

    @TempDir
    Path tempDir;

    private final SongSheetReader reader = new SongSheetReader();

    @Test
    void readsWholeFile() throws Exception {
        Path sheet = tempDir.resolve("song.txt");
        Files.writeString(sheet, "Title\n\nCΔ7\nla\n", StandardCharsets.UTF_8);

        assertThat(reader.read(sheet, StandardCharsets.UTF_8)).isEqualTo("Title\n\nCΔ7\nla\n");
    }

    @Test
    void decodesWithTheGivenCharset() throws Exception {
        Path sheet = tempDir.resolve("latin.txt");
        Files.write(sheet, "Café".getBytes(StandardCharsets.ISO_8859_1));

        assertThat(reader.read(sheet, StandardCharsets.ISO_8859_1)).isEqualTo("Café");
    }

    @Test
    void readsWholeStream() {
        ByteArrayInputStream stream = new ByteArrayInputStream("Title\nartist: Jane\n".getBytes(StandardCharsets.UTF_8));

        assertThat(reader.read(stream, StandardCharsets.UTF_8)).isEqualTo("Title\nartist: Jane\n");
    }

    @Test
    void missingFileIsReportedWithItsPath() {
        Path missing = tempDir.resolve("missing.txt");

        assertThatThrownBy(() -> reader.read(missing, StandardCharsets.UTF_8))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("missing.txt");
    }
}
