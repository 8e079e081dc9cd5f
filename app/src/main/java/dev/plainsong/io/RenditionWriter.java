package dev.plainsong.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes a rendered song to a file, creating missing parent directories.
 */
public class RenditionWriter {

    public void write(Path target, String rendition, Charset charset) {
        if (target == null || rendition == null || charset == null) {
            throw new IllegalArgumentException("target, rendition and charset must be provided");
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, rendition + System.lineSeparator(), charset,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write rendition: " + target, ex);
        }
    }
}
