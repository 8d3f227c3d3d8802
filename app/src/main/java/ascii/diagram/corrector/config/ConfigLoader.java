package ascii.diagram.corrector.config;

import ascii.diagram.corrector.cli.CliArguments;
import ascii.diagram.corrector.correct.CorrectionSettings;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_MAX_ITERS = "AADC_MAX_ITERS";
    static final String ENV_MIN_SCORE = "AADC_MIN_SCORE";
    static final String ENV_TAB_WIDTH = "AADC_TAB_WIDTH";
    static final String ENV_LOG_FORMAT = "AADC_LOG_FORMAT";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        int maxIterations = resolveInteger(arguments.maxIterations(), ENV_MAX_ITERS, "--max-iters",
                CorrectionSettings.DEFAULT_MAX_ITERATIONS);
        int tabWidth = resolveInteger(arguments.tabWidth(), ENV_TAB_WIDTH, "--tab-width",
                CorrectionSettings.DEFAULT_TAB_WIDTH);
        double minScore = resolveMinScore(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        CorrectionSettings settings = new CorrectionSettings(maxIterations, minScore, tabWidth,
                arguments.all(), arguments.verbose());
        return new Config(Optional.ofNullable(arguments.input()), arguments.inPlace(), arguments.backup(),
                arguments.diff(), logFormat, settings);
    }

    private int resolveInteger(Integer cliValue, String envKey, String optionName, int defaultValue) {
        int value = cliValue != null
                ? cliValue
                : environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(raw -> parseInteger(raw, envKey))
                .orElse(defaultValue);
        if (value <= 0) {
            throw new IllegalArgumentException(optionName + " must be a positive integer");
        }
        return value;
    }

    private double resolveMinScore(CliArguments arguments) {
        double value = arguments.minScore() != null
                ? arguments.minScore()
                : environmentReader.get(ENV_MIN_SCORE)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::parseDouble)
                .orElse(CorrectionSettings.DEFAULT_MIN_SCORE);
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException("--min-score must be between 0.0 and 1.0");
        }
        return value;
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static int parseInteger(String raw, String envKey) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(envKey + " must be an integer", ex);
        }
    }

    private static double parseDouble(String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid double value: " + raw, ex);
        }
    }
}
