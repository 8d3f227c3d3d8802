package ascii.diagram.corrector.revise;

import ascii.diagram.corrector.text.CharacterClassifier;
import java.util.Objects;

/**
 * Pushes an existing trailing border right by inserting padding in front of it.
 *
 * @param lineIndex target line within the block
 * @param column current column of the trailing border
 * @param text padding inserted before the border
 * @param deficit number of columns the border is short of the block's border column
 * @param structuralStart whether the line opens with a border, corner or junction
 */
public record PadBeforeSuffixBorder(int lineIndex, int column, String text, int deficit, boolean structuralStart)
        implements Revision {

    static final int DEFICIT_CAP = 4;
    static final int SANITY_LIMIT = 32;

    public PadBeforeSuffixBorder {
        Objects.requireNonNull(text, "text");
        if (deficit <= 0) {
            throw new IllegalArgumentException("deficit must be positive");
        }
    }

    @Override
    public double score() {
        double score = 0.5 + 0.3 * Math.min(deficit, DEFICIT_CAP) / DEFICIT_CAP;
        if (structuralStart) {
            score += 0.1;
        }
        if (deficit > SANITY_LIMIT) {
            score -= 0.5;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    @Override
    public String apply(String line) {
        int boundary = ColumnInsertion.boundaryAt(line, column);
        if (boundary >= line.length()) {
            throw new RevisionOutOfRangeException("No border left at column " + column);
        }
        int border = line.codePointAt(boundary);
        if (CharacterClassifier.isHorizontalFill(border) || !CharacterClassifier.isBoxChar(border)) {
            throw new RevisionOutOfRangeException("Column " + column + " no longer holds a border");
        }
        return ColumnInsertion.insert(line, boundary, text);
    }
}
