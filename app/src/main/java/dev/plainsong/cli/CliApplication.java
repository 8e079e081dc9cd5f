package dev.plainsong.cli;

import dev.plainsong.config.Config;
import dev.plainsong.config.ConfigLoader;
import dev.plainsong.config.EnvironmentReader;
import dev.plainsong.config.OutputFormat;
import dev.plainsong.io.RenditionWriter;
import dev.plainsong.io.SongSheetReader;
import dev.plainsong.logging.LoggingConfigurator;
import dev.plainsong.parser.SongParser;
import dev.plainsong.render.HtmlRenderer;
import dev.plainsong.render.LatexRenderer;
import dev.plainsong.render.SongRenderer;
import dev.plainsong.render.StructureDumpRenderer;
import dev.plainsong.song.Song;
import dev.plainsong.song.SongPart;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * Entry point: reads a song sheet, parses it and prints the requested rendition.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_IO_FAILURE = 1;
    private static final String MDC_SOURCE = "source";
    private static final String STDIN = "<stdin>";

    private final ConfigLoader configLoader;
    private final SongSheetReader songSheetReader;
    private final RenditionWriter renditionWriter;
    private final SongParser songParser;
    private final InputStream standardInput;
    private final PrintStream standardOutput;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), new SongSheetReader(), new RenditionWriter(),
                new SongParser(), System.in, System.out);
    }

    CliApplication(ConfigLoader configLoader,
                   SongSheetReader songSheetReader,
                   RenditionWriter renditionWriter,
                   SongParser songParser,
                   InputStream standardInput,
                   PrintStream standardOutput) {
        this.configLoader = configLoader;
        this.songSheetReader = songSheetReader;
        this.renditionWriter = renditionWriter;
        this.songParser = songParser;
        this.standardInput = standardInput;
        this.standardOutput = standardOutput;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());

        MDC.put(MDC_SOURCE, config.input().map(Object::toString).orElse(STDIN));
        try {
            String content = readSheet(config);
            Song song = songParser.parse(content);
            LOGGER.info("Parsed '{}': {} parts, {} lines", song.title(), song.parts().size(),
                    song.parts().stream().mapToInt(part -> part.lines().size()).sum());
            if (LOGGER.isDebugEnabled()) {
                for (SongPart part : song.parts()) {
                    LOGGER.debug("Part '{}' has {} lines", part.name(), part.lines().size());
                }
            }

            String rendition = rendererFor(config.format()).render(song);
            if (config.output().isPresent()) {
                renditionWriter.write(config.output().get(), rendition, config.charset());
                LOGGER.info("Wrote {} output to {}", config.format().command(), config.output().get());
            } else {
                standardOutput.println(rendition);
                standardOutput.flush();
            }
            return 0;
        } catch (UncheckedIOException ex) {
            LOGGER.error(ex.getMessage(), ex.getCause());
            return EXIT_IO_FAILURE;
        } finally {
            MDC.remove(MDC_SOURCE);
        }
    }

    private String readSheet(Config config) {
        if (config.readsStandardInput()) {
            LOGGER.info("Filename has been omitted, reading song sheet from standard input");
            return songSheetReader.read(standardInput, config.charset());
        }
        LOGGER.info("Reading song sheet from {}", config.input().get());
        return songSheetReader.read(config.input().get(), config.charset());
    }

    private SongRenderer rendererFor(OutputFormat format) {
        return switch (format) {
            case RON -> new StructureDumpRenderer();
            case LATEX -> new LatexRenderer();
            case HTML -> new HtmlRenderer();
        };
    }
}
