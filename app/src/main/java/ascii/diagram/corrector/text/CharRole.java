package ascii.diagram.corrector.text;

/**
 * Structural role a single character plays in a box drawing.
 */
public enum CharRole {
    CORNER,
    HORIZONTAL_FILL,
    VERTICAL_BORDER,
    JUNCTION,
    PLAIN;

    public boolean isStructural() {
        return this == CORNER || this == VERTICAL_BORDER || this == JUNCTION;
    }
}
