package ascii.diagram.corrector.analysis;

import ascii.diagram.corrector.text.VisualWidth;
import java.util.Optional;

/**
 * Derives structural metadata from single lines of text.
 */
public interface LineAnalyzer {

    LineRecord analyze(String line);

    default int visualWidth(String text) {
        return VisualWidth.of(text);
    }

    LineClassification classify(String line);

    Optional<SuffixBorder> detectSuffixBorder(String line);

    /**
     * Reports the trailing border only when it sits within {@code tolerance} columns of
     * {@code expectedColumn}.
     */
    default Optional<SuffixBorder> detectSuffixBorder(String line, int expectedColumn, int tolerance) {
        return detectSuffixBorder(line)
                .filter(border -> Math.abs(border.column() - expectedColumn) <= tolerance);
    }
}
