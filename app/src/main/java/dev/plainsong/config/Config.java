package dev.plainsong.config;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 *
 * <p>An empty {@code input} means the song sheet is read from standard input; an empty
 * {@code output} means the rendition is printed to standard output.
 */
public record Config(
        OutputFormat format,
        Optional<Path> input,
        Optional<Path> output,
        Charset charset,
        LogFormat logFormat,
        boolean verbose
) {

    public Config {
        Objects.requireNonNull(format, "format");
        input = input == null ? Optional.empty() : input;
        output = output == null ? Optional.empty() : output;
        Objects.requireNonNull(charset, "charset");
        Objects.requireNonNull(logFormat, "logFormat");
    }

    public boolean readsStandardInput() {
        return input.isEmpty();
    }
}
