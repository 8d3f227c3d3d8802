package ascii.diagram.corrector.correct;

import ascii.diagram.corrector.analysis.LineAnalyzer;
import ascii.diagram.corrector.analysis.LineRecord;
import ascii.diagram.corrector.detect.Block;
import ascii.diagram.corrector.revise.Revision;
import ascii.diagram.corrector.revise.RevisionEngine;
import ascii.diagram.corrector.revise.RevisionOutOfRangeException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one block toward a fixed point: scan, apply every qualifying revision, rescan, until
 * nothing qualifies or the iteration cap is reached.
 */
public class CorrectionLoop {

    private static final Logger LOGGER = LoggerFactory.getLogger(CorrectionLoop.class);

    private final LineAnalyzer analyzer;
    private final RevisionEngine revisionEngine;

    public CorrectionLoop(LineAnalyzer analyzer, RevisionEngine revisionEngine) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.revisionEngine = Objects.requireNonNull(revisionEngine, "revisionEngine");
    }

    public BlockOutcome run(Block block, int maxIterations, double minScore) {
        Objects.requireNonNull(block, "block");
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive");
        }

        List<String> lines = block.lines();
        List<LineRecord> records = block.records();
        List<Revision> pending = List.of();
        int iterations = 0;
        int applied = 0;
        LoopState state = LoopState.SCANNING;

        while (!state.isTerminal()) {
            switch (state) {
                case SCANNING -> {
                    records = lines.stream().map(analyzer::analyze).toList();
                    pending = revisionEngine.select(revisionEngine.propose(records), minScore);
                    if (pending.isEmpty()) {
                        state = LoopState.CONVERGED;
                    } else if (iterations >= maxIterations) {
                        state = LoopState.ITERATION_LIMIT_REACHED;
                    } else {
                        state = LoopState.REVISING;
                    }
                }
                case REVISING -> {
                    List<String> revised = new ArrayList<>(lines);
                    int appliedThisPass = 0;
                    for (Revision revision : pending) {
                        int index = revision.lineIndex();
                        try {
                            revised.set(index, revision.apply(revised.get(index)));
                            appliedThisPass++;
                        } catch (RevisionOutOfRangeException ex) {
                            LOGGER.debug("Dropping revision for line {}: {}", block.startLine() + index + 1, ex.getMessage());
                        }
                    }
                    lines = List.copyOf(revised);
                    applied += appliedThisPass;
                    iterations++;
                    LOGGER.debug("Block at line {}: iteration {} applied {} revision(s)",
                            block.startLine() + 1, iterations, appliedThisPass);
                    state = LoopState.SCANNING;
                }
                default -> throw new IllegalStateException("Unexpected loop state " + state);
            }
        }

        if (state == LoopState.ITERATION_LIMIT_REACHED) {
            LOGGER.debug("Block at line {} stopped after {} iteration(s) without converging",
                    block.startLine() + 1, iterations);
        }
        return new BlockOutcome(block.withRecords(records), state, iterations, applied);
    }
}
