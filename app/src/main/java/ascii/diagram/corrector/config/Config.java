package ascii.diagram.corrector.config;

import ascii.diagram.corrector.correct.CorrectionSettings;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 *
 * @param input file to correct; standard input when empty
 * @param inPlace rewrite the input file instead of printing the result
 * @param backup keep a copy of the input file before rewriting it
 * @param diff print a unified diff instead of the corrected document
 * @param logFormat encoder used for log output
 * @param settings options handed to the correction engine
 */
public record Config(
        Optional<Path> input,
        boolean inPlace,
        boolean backup,
        boolean diff,
        LogFormat logFormat,
        CorrectionSettings settings
) {

    public Config {
        input = input == null ? Optional.empty() : input;
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        settings = Objects.requireNonNull(settings, "settings");
        if (inPlace && input.isEmpty()) {
            throw new IllegalArgumentException("--in-place requires an input file");
        }
        if (backup && !inPlace) {
            throw new IllegalArgumentException("--backup can only be used with --in-place");
        }
    }

    public boolean verbose() {
        return settings.verbose();
    }

    public String inputLabel() {
        return input.map(path -> path.toString().replace('\\', '/')).orElse("stdin");
    }
}
