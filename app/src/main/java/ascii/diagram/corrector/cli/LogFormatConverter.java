package ascii.diagram.corrector.cli;

import ascii.diagram.corrector.config.LogFormat;
import picocli.CommandLine;

/**
 * Parses the {@code --log-format} option, reporting unknown formats as usage errors.
 */
public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {
    @Override
    public LogFormat convert(String value) {
        try {
            return LogFormat.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage() + " (expected text or json)");
        }
    }
}
