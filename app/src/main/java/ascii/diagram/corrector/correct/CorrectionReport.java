package ascii.diagram.corrector.correct;

import java.util.List;
import java.util.Objects;

/**
 * Per-run diagnostics for callers that render verbose output or statistics.
 */
public record CorrectionReport(int blocksFound, int blocksModified, int revisionsApplied, int iterations,
                               List<BlockReport> blocks) {

    public CorrectionReport {
        blocks = List.copyOf(Objects.requireNonNull(blocks, "blocks"));
    }

    public static CorrectionReport of(List<BlockReport> blocks) {
        int modified = (int) blocks.stream().filter(block -> block.revisionsApplied() > 0).count();
        int revisions = blocks.stream().mapToInt(BlockReport::revisionsApplied).sum();
        int iterations = blocks.stream().mapToInt(BlockReport::iterations).sum();
        return new CorrectionReport(blocks.size(), modified, revisions, iterations, blocks);
    }

    public boolean hitIterationLimit() {
        return blocks.stream().anyMatch(block -> block.state() == LoopState.ITERATION_LIMIT_REACHED);
    }
}
