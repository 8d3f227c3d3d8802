package ascii.diagram.corrector.text;

import java.util.Set;

/**
 * Maps codepoints to their {@link CharRole}. Every codepoint outside the fixed role sets is plain.
 */
public final class CharacterClassifier {

    private static final Set<Integer> CORNERS = codePoints("+┌┐└┘╔╗╚╝╭╮╯╰┏┓┗┛╒╕╘╛╓╖╙╜");
    private static final Set<Integer> HORIZONTAL_FILLS = codePoints("-─━═╌╍┄┅┈┉~=");
    private static final Set<Integer> VERTICAL_BORDERS = codePoints("|│┃║╎╏┆┇┊┋");
    private static final Set<Integer> JUNCTIONS = codePoints("┬┴├┤┼╦╩╠╣╬╤╧╟╢╫╪┳┻┣┫╋");

    private CharacterClassifier() {
    }

    public static CharRole classify(int codePoint) {
        if (CORNERS.contains(codePoint)) {
            return CharRole.CORNER;
        }
        if (HORIZONTAL_FILLS.contains(codePoint)) {
            return CharRole.HORIZONTAL_FILL;
        }
        if (VERTICAL_BORDERS.contains(codePoint)) {
            return CharRole.VERTICAL_BORDER;
        }
        if (JUNCTIONS.contains(codePoint)) {
            return CharRole.JUNCTION;
        }
        return CharRole.PLAIN;
    }

    public static boolean isCorner(int codePoint) {
        return CORNERS.contains(codePoint);
    }

    public static boolean isHorizontalFill(int codePoint) {
        return HORIZONTAL_FILLS.contains(codePoint);
    }

    public static boolean isVerticalBorder(int codePoint) {
        return VERTICAL_BORDERS.contains(codePoint);
    }

    public static boolean isJunction(int codePoint) {
        return JUNCTIONS.contains(codePoint);
    }

    public static boolean isBoxChar(int codePoint) {
        return classify(codePoint) != CharRole.PLAIN;
    }

    private static Set<Integer> codePoints(String members) {
        return Set.copyOf(members.codePoints().boxed().toList());
    }
}
