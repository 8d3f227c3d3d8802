package ascii.diagram.corrector.correct;

import java.util.Objects;

/**
 * Diagnostics for one corrected block. Line numbers are 1-based.
 */
public record BlockReport(int firstLine, int lastLine, double confidence, LoopState state, int iterations,
                          int revisionsApplied) {

    public BlockReport {
        Objects.requireNonNull(state, "state");
    }

    static BlockReport from(BlockOutcome outcome) {
        return new BlockReport(outcome.block().startLine() + 1, outcome.block().endLine() + 1,
                outcome.block().confidence(), outcome.state(), outcome.iterations(), outcome.revisionsApplied());
    }
}
