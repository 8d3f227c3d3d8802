package ascii.diagram.corrector.revise;

import java.util.OptionalInt;

/**
 * Alignment targets shared by every line of a block.
 *
 * @param borderColumn rightmost trailing-border column of the block's diagram lines
 * @param borderCodePoint most frequent vertical border character of the block
 * @param leadingColumn most frequent column of an opening vertical border, if any line has one
 */
public record BlockGeometry(int borderColumn, int borderCodePoint, OptionalInt leadingColumn) {

    public BlockGeometry {
        if (borderColumn < 0) {
            throw new IllegalArgumentException("borderColumn must not be negative");
        }
        leadingColumn = leadingColumn == null ? OptionalInt.empty() : leadingColumn;
    }

    public String borderCharacter() {
        return new String(Character.toChars(borderCodePoint));
    }
}
