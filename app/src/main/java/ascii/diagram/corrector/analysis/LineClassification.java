package ascii.diagram.corrector.analysis;

/**
 * Heuristic classification of a single line of text.
 */
public enum LineClassification {
    DIAGRAM,
    PROSE,
    CODE,
    BLANK;

    public boolean isDiagram() {
        return this == DIAGRAM;
    }
}
