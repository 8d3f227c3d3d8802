package ascii.diagram.corrector.analysis;

import ascii.diagram.corrector.text.CharRole;
import java.util.Objects;

/**
 * Trailing border character of a line and the visual column it starts at.
 */
public record SuffixBorder(int column, int codePoint, CharRole role) {

    public SuffixBorder {
        Objects.requireNonNull(role, "role");
        if (column < 0) {
            throw new IllegalArgumentException("column must not be negative");
        }
        if (!role.isStructural()) {
            throw new IllegalArgumentException("suffix border must be a corner, junction or vertical border");
        }
    }

    public String character() {
        return new String(Character.toChars(codePoint));
    }
}
