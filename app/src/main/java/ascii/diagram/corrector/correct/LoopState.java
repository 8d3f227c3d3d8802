package ascii.diagram.corrector.correct;

/**
 * States of the per-block correction loop.
 */
public enum LoopState {
    SCANNING,
    REVISING,
    CONVERGED,
    ITERATION_LIMIT_REACHED;

    public boolean isTerminal() {
        return this == CONVERGED || this == ITERATION_LIMIT_REACHED;
    }
}
