package ascii.diagram.corrector.revise;

import java.util.Objects;

/**
 * Closes a line that opens with a border but never closes, placing the block's border character on
 * the block's border column.
 *
 * @param lineIndex target line within the block
 * @param column column the padding and border are inserted at
 * @param text padding followed by the border character
 * @param matchingBorder whether the line opens with the block's own border character
 * @param similarLength whether the line spans at least half of the block width or lines up with a neighbouring row
 */
public record AddSuffixBorder(int lineIndex, int column, String text, boolean matchingBorder, boolean similarLength)
        implements Revision {

    public AddSuffixBorder {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            throw new IllegalArgumentException("text must contain the border character");
        }
    }

    @Override
    public double score() {
        double score = 0.35;
        if (matchingBorder) {
            score += 0.1;
        }
        if (similarLength) {
            score += 0.1;
        }
        return score;
    }

    @Override
    public String apply(String line) {
        int boundary = ColumnInsertion.boundaryAt(line, column);
        if (!line.substring(boundary).isBlank()) {
            throw new RevisionOutOfRangeException("Content extends past column " + column);
        }
        return ColumnInsertion.insert(line, boundary, text);
    }
}
