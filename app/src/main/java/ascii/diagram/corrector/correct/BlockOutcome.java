package ascii.diagram.corrector.correct;

import ascii.diagram.corrector.detect.Block;
import java.util.Objects;

/**
 * Final state of one block after its correction loop terminated.
 */
public record BlockOutcome(Block block, LoopState state, int iterations, int revisionsApplied) {

    public BlockOutcome {
        Objects.requireNonNull(block, "block");
        Objects.requireNonNull(state, "state");
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("outcome state must be terminal: " + state);
        }
    }

    public boolean modified() {
        return revisionsApplied > 0;
    }
}
