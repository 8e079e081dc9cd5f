package dev.plainsong.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a complete song sheet into memory, either from a file or from a stream such as stdin.
 */
public class SongSheetReader {

    public String read(Path path, Charset charset) {
        if (path == null || charset == null) {
            throw new IllegalArgumentException("path and charset must be provided");
        }
        try {
            return Files.readString(path, charset);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read song sheet: " + path, ex);
        }
    }

    public String read(InputStream stream, Charset charset) {
        if (stream == null || charset == null) {
            throw new IllegalArgumentException("stream and charset must be provided");
        }
        try {
            return new String(stream.readAllBytes(), charset);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read song sheet from input stream", ex);
        }
    }
}
