package ascii.diagram.corrector.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ascii.diagram.corrector.config.ConfigLoader;
import ascii.diagram.corrector.correct.DiagramCorrector;
import ascii.diagram.corrector.diff.UnifiedDiffRenderer;
import ascii.diagram.corrector.document.DocumentReader;
import ascii.diagram.corrector.document.DocumentWriter;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    private static final String MISALIGNED = "+-------+\n| hi|\n+-------+\n";
    private static final String ALIGNED = "+-------+\n| hi    |\n+-------+\n";

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

    @Test
    void correctsStandardInput() {
        int exitCode = application(MISALIGNED).run(new String[0]);

        assertThat(exitCode).isZero();
        assertThat(output()).isEqualTo(ALIGNED);
    }

    @Test
    void reproducesUnchangedInputByteForByte() {
        String input = "first line\r\nsecond line without newline";

        int exitCode = application(input).run(new String[0]);

        assertThat(exitCode).isZero();
        assertThat(output()).isEqualTo(input);
    }

    @Test
    void keepsMixedLineEndingsWhileCorrecting() {
        int exitCode = application("+-------+\n| hi|\r\n| open\r\n+-------+\n").run(new String[0]);

        assertThat(exitCode).isZero();
        assertThat(output()).isEqualTo("+-------+\n| hi    |\r\n| open  |\r\n+-------+\n");
    }

    @Test
    void readsNamedFile() throws IOException {
        Path file = tempDir.resolve("diagram.txt");
        Files.writeString(file, MISALIGNED, StandardCharsets.UTF_8);

        int exitCode = application("").run(new String[] {file.toString()});

        assertThat(exitCode).isZero();
        assertThat(output()).isEqualTo(ALIGNED);
        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(MISALIGNED);
    }

    @Test
    void rewritesFileInPlaceKeepingBackup() throws IOException {
        Path file = tempDir.resolve("diagram.txt");
        Files.writeString(file, MISALIGNED, StandardCharsets.UTF_8);

        int exitCode = application("").run(new String[] {"--in-place", "--backup", file.toString()});

        assertThat(exitCode).isZero();
        assertThat(output()).isEmpty();
        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(ALIGNED);
        assertThat(Files.readString(tempDir.resolve("diagram.txt.bak"), StandardCharsets.UTF_8)).isEqualTo(MISALIGNED);
    }

    @Test
    void leavesAlignedFileUntouchedInPlace() throws IOException {
        Path file = tempDir.resolve("diagram.txt");
        Files.writeString(file, ALIGNED, StandardCharsets.UTF_8);

        int exitCode = application("").run(new String[] {"-i", "-b", file.toString()});

        assertThat(exitCode).isZero();
        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(ALIGNED);
        assertThat(tempDir.resolve("diagram.txt.bak")).doesNotExist();
    }

    @Test
    void printsUnifiedDiff() {
        int exitCode = application(MISALIGNED).run(new String[] {"--diff"});

        assertThat(exitCode).isZero();
        assertThat(output())
                .startsWith("--- a/stdin\n+++ b/stdin\n@@ -1,3 +1,3 @@\n")
                .contains("-| hi|\n")
                .contains("+| hi    |\n");
    }

    @Test
    void printsNothingForDiffWithoutChanges() {
        int exitCode = application(ALIGNED).run(new String[] {"-d"});

        assertThat(exitCode).isZero();
        assertThat(output()).isEmpty();
    }

    @Test
    void respectsMinimumScore() {
        int exitCode = application(MISALIGNED).run(new String[] {"--min-score", "0.95"});

        assertThat(exitCode).isZero();
        assertThat(output()).isEqualTo(MISALIGNED);
    }

    @Test
    void missingFileFails() {
        int exitCode = application("").run(new String[] {tempDir.resolve("absent.txt").toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_FAILURE);
        assertThat(errors()).contains("Failed to read input file");
        assertThat(output()).isEmpty();
    }

    @Test
    void inPlaceWithoutFileIsUsageError() {
        int exitCode = application(MISALIGNED).run(new String[] {"--in-place"});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_USAGE);
        assertThat(errors()).contains("--in-place requires an input file");
    }

    @Test
    void invalidOptionValueIsUsageError() {
        assertThat(application("").run(new String[] {"--min-score", "2"})).isEqualTo(CliApplication.EXIT_USAGE);
        assertThat(application("").run(new String[] {"--log-format", "xml"})).isEqualTo(CliApplication.EXIT_USAGE);
        assertThat(application("").run(new String[] {"--no-such-option"})).isEqualTo(CliApplication.EXIT_USAGE);
    }

    @Test
    void printsUsageOnHelp() {
        int exitCode = application("").run(new String[] {"--help"});

        assertThat(exitCode).isZero();
        assertThat(output()).contains("aadc").contains("--in-place").contains("--tab-width");
    }

    private CliApplication application(String stdin) {
        return new CliApplication(
                new ConfigLoader(key -> Optional.empty()),
                new DocumentReader(),
                new DocumentWriter(),
                new DiagramCorrector(),
                new UnifiedDiffRenderer(),
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(stdout, true, StandardCharsets.UTF_8),
                new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private String errors() {
        return stderr.toString(StandardCharsets.UTF_8);
    }
}
