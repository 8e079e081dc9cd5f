package dev.plainsong.cli;

import dev.plainsong.config.LogFormat;
import dev.plainsong.config.OutputFormat;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "plainsong", mixinStandardHelpOptions = true, version = "plainsong 0.1.0",
        description = "Converts a chords-over-lyrics song sheet into a LaTeX song, HTML or a structural dump")
public class CliArguments {

    @CommandLine.Parameters(index = "0", converter = OutputFormatConverter.class, paramLabel = "FORMAT",
            description = "Output: to-ron, to-latex or to-html")
    private OutputFormat format;

    @CommandLine.Parameters(index = "1", arity = "0..1", paramLabel = "FILE",
            description = "Song sheet to read; standard input when omitted")
    private Path input;

    @CommandLine.Option(names = {"-o", "--output"}, paramLabel = "FILE", description = "Write the result to FILE instead of standard output")
    private Path output;

    @CommandLine.Option(names = "--charset", paramLabel = "NAME", description = "Charset of the song sheet and of the output (default UTF-8)")
    private String charset;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log parser decisions at debug level")
    private boolean verbose;

    public OutputFormat format() {
        return format;
    }

    public Path input() {
        return input;
    }

    public Path output() {
        return output;
    }

    public String charset() {
        return charset;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
