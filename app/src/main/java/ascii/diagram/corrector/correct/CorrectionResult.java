package ascii.diagram.corrector.correct;

import java.util.List;
import java.util.Objects;

/**
 * Corrected document lines together with the run diagnostics.
 */
public record CorrectionResult(List<String> lines, CorrectionReport report) {

    public CorrectionResult {
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        Objects.requireNonNull(report, "report");
    }

    public boolean modified() {
        return report.revisionsApplied() > 0;
    }
}
