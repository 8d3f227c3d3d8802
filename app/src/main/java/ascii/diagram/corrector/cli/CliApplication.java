package ascii.diagram.corrector.cli;

import ascii.diagram.corrector.config.Config;
import ascii.diagram.corrector.config.ConfigLoader;
import ascii.diagram.corrector.config.SystemEnvironmentReader;
import ascii.diagram.corrector.correct.CorrectionReport;
import ascii.diagram.corrector.correct.CorrectionResult;
import ascii.diagram.corrector.correct.DiagramCorrector;
import ascii.diagram.corrector.diff.UnifiedDiffRenderer;
import ascii.diagram.corrector.document.DocumentIoException;
import ascii.diagram.corrector.document.DocumentReader;
import ascii.diagram.corrector.document.DocumentText;
import ascii.diagram.corrector.document.DocumentWriter;
import ascii.diagram.corrector.logging.LoggingConfigurator;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and correction pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final ConfigLoader configLoader;
    private final DocumentReader documentReader;
    private final DocumentWriter documentWriter;
    private final DiagramCorrector corrector;
    private final UnifiedDiffRenderer diffRenderer;
    private final InputStream stdin;
    private final PrintStream stdout;
    private final PrintStream stderr;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new DocumentReader(), new DocumentWriter(),
                new DiagramCorrector(), new UnifiedDiffRenderer(), System.in,
                new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8),
                new PrintStream(new FileOutputStream(FileDescriptor.err), true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, DocumentReader documentReader, DocumentWriter documentWriter,
                   DiagramCorrector corrector, UnifiedDiffRenderer diffRenderer,
                   InputStream stdin, PrintStream stdout, PrintStream stderr) {
        this.configLoader = configLoader;
        this.documentReader = documentReader;
        this.documentWriter = documentWriter;
        this.corrector = corrector;
        this.diffRenderer = diffRenderer;
        this.stdin = stdin;
        this.stdout = stdout;
        this.stderr = stderr;
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
            stderr.println(ex.getMessage());
            commandLine.usage(stderr);
            return EXIT_USAGE;
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(stdout);
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(stdout);
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            stderr.println("Error: " + ex.getMessage());
            return EXIT_USAGE;
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());

        try {
            return process(config);
        } catch (DocumentIoException ex) {
            LOGGER.debug("I/O failure", ex);
            stderr.println("Error: " + describe(ex));
            return EXIT_FAILURE;
        } catch (RuntimeException ex) {
            LOGGER.error("Unexpected failure while correcting {}", config.inputLabel(), ex);
            stderr.println("Error: " + ex.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int process(Config config) {
        DocumentText document = config.input()
                .map(documentReader::read)
                .orElseGet(() -> documentReader.read(stdin));
        LOGGER.debug("Processing {} line(s) from {}", document.lines().size(), config.inputLabel());

        CorrectionResult result = corrector.correct(document.lines(), config.settings());
        DocumentText corrected = document.withLines(result.lines());
        summarize(config, result.report());

        if (config.inPlace()) {
            Path target = config.input().orElseThrow();
            if (result.modified()) {
                documentWriter.write(target, corrected, config.backup());
                LOGGER.info("Rewrote {}", target);
            } else {
                LOGGER.info("No changes needed for {}", target);
            }
        }
        if (config.diff()) {
            stdout.print(diffRenderer.render(config.inputLabel(), document.lines(), corrected.lines()));
        } else if (!config.inPlace()) {
            stdout.print(corrected.render());
        }
        stdout.flush();
        return EXIT_OK;
    }

    private void summarize(Config config, CorrectionReport report) {
        if (report.hitIterationLimit()) {
            LOGGER.warn("Iteration limit reached for at least one block in {}", config.inputLabel());
        }
        if (config.verbose()) {
            LOGGER.info("Processed {}: {} block(s), {} modified, {} revision(s) applied",
                    config.inputLabel(), report.blocksFound(), report.blocksModified(), report.revisionsApplied());
        }
    }

    private static String describe(DocumentIoException ex) {
        Throwable cause = ex.getCause();
        if (cause == null || cause.getMessage() == null) {
            return ex.getMessage();
        }
        return ex.getMessage() + " (" + cause.getClass().getSimpleName() + ")";
    }
}
