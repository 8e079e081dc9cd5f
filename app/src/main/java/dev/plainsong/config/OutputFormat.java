package dev.plainsong.config;

/**
 * What the CLI prints for a parsed song.
 */
public enum OutputFormat {
    RON("to-ron"),
    LATEX("to-latex"),
    HTML("to-html");

    private final String command;

    OutputFormat(String command) {
        this.command = command;
    }

    public String command() {
        return command;
    }

    public static OutputFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Output format must be provided");
        }
        for (OutputFormat format : values()) {
            if (format.command.equalsIgnoreCase(raw.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported output format: " + raw + " (expected to-ron, to-latex or to-html)");
    }
}
