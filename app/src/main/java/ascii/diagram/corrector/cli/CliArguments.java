package ascii.diagram.corrector.cli;

import ascii.diagram.corrector.config.LogFormat;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "aadc", mixinStandardHelpOptions = true,
        description = "Corrects misaligned right borders in ASCII and Unicode box-drawing diagrams")
public class CliArguments {

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "FILE",
            description = "Input file; standard input when omitted")
    private Path input;

    @CommandLine.Option(names = {"-i", "--in-place"}, description = "Rewrite FILE instead of printing the result")
    private boolean inPlace;

    @CommandLine.Option(names = {"-b", "--backup"}, description = "Keep FILE.bak when rewriting in place")
    private boolean backup;

    @CommandLine.Option(names = {"-d", "--diff"}, description = "Print a unified diff instead of the corrected text")
    private boolean diff;

    @CommandLine.Option(names = {"-a", "--all"}, description = "Correct every detected block regardless of confidence")
    private boolean all;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Report detected blocks and iterations on stderr")
    private boolean verbose;

    @CommandLine.Option(names = {"-m", "--max-iters"}, paramLabel = "N",
            description = "Maximum correction iterations per block (default: 10)")
    private Integer maxIterations;

    @CommandLine.Option(names = {"-s", "--min-score"}, paramLabel = "SCORE",
            description = "Minimum score for blocks and revisions, 0.0 to 1.0 (default: 0.5)")
    private Double minScore;

    @CommandLine.Option(names = {"-t", "--tab-width"}, paramLabel = "N",
            description = "Columns per tab stop (default: 4)")
    private Integer tabWidth;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Path input() {
        return input;
    }

    public boolean inPlace() {
        return inPlace;
    }

    public boolean backup() {
        return backup;
    }

    public boolean diff() {
        return diff;
    }

    public boolean all() {
        return all;
    }

    public boolean verbose() {
        return verbose;
    }

    public Integer maxIterations() {
        return maxIterations;
    }

    public Double minScore() {
        return minScore;
    }

    public Integer tabWidth() {
        return tabWidth;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
