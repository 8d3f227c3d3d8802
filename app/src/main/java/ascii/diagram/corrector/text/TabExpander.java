package ascii.diagram.corrector.text;

/**
 * Replaces tab characters with spaces up to the next tab stop, measured in visual columns.
 */
public final class TabExpander {

    private final int tabWidth;

    public TabExpander(int tabWidth) {
        if (tabWidth <= 0) {
            throw new IllegalArgumentException("tabWidth must be positive");
        }
        this.tabWidth = tabWidth;
    }

    public String expand(String line) {
        if (line.indexOf('\t') < 0) {
            return line;
        }
        StringBuilder expanded = new StringBuilder(line.length() + tabWidth);
        int column = 0;
        for (int i = 0; i < line.length(); ) {
            int codePoint = line.codePointAt(i);
            i += Character.charCount(codePoint);
            if (codePoint == '\t') {
                int spaces = tabWidth - (column % tabWidth);
                expanded.append(" ".repeat(spaces));
                column += spaces;
            } else {
                expanded.appendCodePoint(codePoint);
                column += VisualWidth.of(codePoint);
            }
        }
        return expanded.toString();
    }

    public int tabWidth() {
        return tabWidth;
    }
}
