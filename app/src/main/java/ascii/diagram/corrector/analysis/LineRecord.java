package ascii.diagram.corrector.analysis;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Immutable analysis of one line. A new record is produced for every correction pass.
 *
 * @param content raw line content, tabs already expanded
 * @param classification heuristic line classification
 * @param visualWidth width of the whole line in terminal columns
 * @param contentWidth width of the line without trailing whitespace
 * @param suffixBorder trailing border, if the line ends with one
 * @param leadingBorderColumn column of a vertical border opening the line, if any
 * @param structuralStart whether the first non-blank character is a corner, junction or vertical border
 * @param verticalBorderColumns columns of every vertical border character, ascending
 */
public record LineRecord(
        String content,
        LineClassification classification,
        int visualWidth,
        int contentWidth,
        Optional<SuffixBorder> suffixBorder,
        OptionalInt leadingBorderColumn,
        boolean structuralStart,
        List<Integer> verticalBorderColumns
) {

    public LineRecord {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(classification, "classification");
        suffixBorder = suffixBorder == null ? Optional.empty() : suffixBorder;
        leadingBorderColumn = leadingBorderColumn == null ? OptionalInt.empty() : leadingBorderColumn;
        verticalBorderColumns = verticalBorderColumns == null ? List.of() : List.copyOf(verticalBorderColumns);
        if (contentWidth > visualWidth) {
            throw new IllegalArgumentException("contentWidth must not exceed visualWidth");
        }
    }

    public boolean isDiagram() {
        return classification.isDiagram();
    }

    public boolean isBlank() {
        return classification == LineClassification.BLANK;
    }

    public boolean isTerminatedAt(int column) {
        return suffixBorder.map(border -> border.column() == column).orElse(false);
    }
}
