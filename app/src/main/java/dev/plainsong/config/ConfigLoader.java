package dev.plainsong.config;

import dev.plainsong.cli.CliArguments;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_LOG_FORMAT = "PLAINSONG_LOG_FORMAT";
    static final String ENV_CHARSET = "PLAINSONG_CHARSET";
    static final String ENV_VERBOSE = "PLAINSONG_VERBOSE";

    private static final Charset DEFAULT_CHARSET = StandardCharsets.UTF_8;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        if (arguments.format() == null) {
            throw new IllegalArgumentException("Output format must be provided (to-ron, to-latex or to-html)");
        }
        return new Config(arguments.format(),
                Optional.ofNullable(arguments.input()),
                Optional.ofNullable(arguments.output()),
                resolveCharset(arguments),
                resolveLogFormat(arguments),
                resolveVerbose(arguments));
    }

    private Charset resolveCharset(CliArguments arguments) {
        return Optional.ofNullable(arguments.charset())
                .filter(value -> !value.isBlank())
                .or(() -> environmentReader.getNonBlank(ENV_CHARSET))
                .map(ConfigLoader::parseCharset)
                .orElse(DEFAULT_CHARSET);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.getNonBlank(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private boolean resolveVerbose(CliArguments arguments) {
        if (arguments.verbose()) {
            return true;
        }
        return environmentReader.getNonBlank(ENV_VERBOSE)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private static Charset parseCharset(String raw) {
        try {
            return Charset.forName(raw.trim());
        } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
            throw new IllegalArgumentException("Unsupported charset: " + raw, ex);
        }
    }
}
