package ascii.diagram.corrector.revise;

import ascii.diagram.corrector.text.VisualWidth;

final class ColumnInsertion {

    private ColumnInsertion() {
    }

    /**
     * Finds the last char index whose prefix is exactly {@code column} columns wide, so zero-width
     * marks stay attached to the character before them.
     */
    static int boundaryAt(String line, int column) {
        if (column < 0) {
            throw new RevisionOutOfRangeException("Negative insertion column " + column);
        }
        int width = 0;
        int boundary = -1;
        for (int i = 0; i < line.length(); ) {
            if (width == column) {
                boundary = i;
            } else if (width > column) {
                break;
            }
            int codePoint = line.codePointAt(i);
            width += VisualWidth.of(codePoint);
            i += Character.charCount(codePoint);
        }
        if (width == column) {
            boundary = line.length();
        }
        if (boundary < 0) {
            throw new RevisionOutOfRangeException(
                    "Column " + column + " is not a character boundary of a line " + VisualWidth.of(line) + " columns wide");
        }
        return boundary;
    }

    static String insert(String line, int boundary, String text) {
        return line.substring(0, boundary) + text + line.substring(boundary);
    }
}
