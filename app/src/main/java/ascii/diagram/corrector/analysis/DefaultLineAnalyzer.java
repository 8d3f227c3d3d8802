package ascii.diagram.corrector.analysis;

import ascii.diagram.corrector.text.CharRole;
import ascii.diagram.corrector.text.CharacterClassifier;
import ascii.diagram.corrector.text.VisualWidth;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Default implementation classifying lines with a conservative decision tree: anything that is
 * not clearly a diagram or clearly code is treated as prose. A line counts as a diagram when box
 * characters make up most of it, when it opens and closes with structure, or when a border or an
 * edge sits at its start or end; a stray glyph inside a sentence does not.
 */
public class DefaultLineAnalyzer implements LineAnalyzer {

    private static final int MIN_EDGE_FILLS = 2;

    private static final Pattern CODE_KEYWORD = Pattern.compile(
            "^(def|fn|func|function|class|interface|enum|struct|public|private|protected|static|import|package|"
                    + "return|if|else|elif|for|while|switch|case|let|const|var|val|#include|#define|@\\w+)\\b");
    private static final Pattern CODE_TERMINATOR = Pattern.compile("(;|\\{|\\})$");
    private static final Pattern CODE_OPERATOR = Pattern.compile("(==|!=|=>|->|::|&&|\\+\\+|\\w\\(.*\\))");
    private static final Pattern CODE_COMMENT = Pattern.compile("^(//|/\\*)");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]$");
    private static final Pattern PROSE_WORDS = Pattern.compile("\\p{L}{2,}(\\s+\\p{L}{2,}){3,}");

    @Override
    public LineRecord analyze(String line) {
        String content = line == null ? "" : line;
        LineClassification classification = classify(content);
        int visualWidth = visualWidth(content);
        int contentWidth = visualWidth(content.stripTrailing());

        Optional<SuffixBorder> suffixBorder = classification == LineClassification.BLANK
                ? Optional.empty()
                : detectSuffixBorder(content);

        List<Integer> verticalBorderColumns = new ArrayList<>();
        OptionalInt leadingBorderColumn = OptionalInt.empty();
        boolean structuralStart = false;
        boolean seenContent = false;
        int column = 0;
        for (int i = 0; i < content.length(); ) {
            int codePoint = content.codePointAt(i);
            i += Character.charCount(codePoint);
            CharRole role = CharacterClassifier.classify(codePoint);
            if (!seenContent && !Character.isWhitespace(codePoint)) {
                seenContent = true;
                structuralStart = role.isStructural();
                if (role == CharRole.VERTICAL_BORDER) {
                    leadingBorderColumn = OptionalInt.of(column);
                }
            }
            if (role == CharRole.VERTICAL_BORDER) {
                verticalBorderColumns.add(column);
            }
            column += VisualWidth.of(codePoint);
        }

        return new LineRecord(content, classification, visualWidth, contentWidth, suffixBorder,
                leadingBorderColumn, structuralStart, verticalBorderColumns);
    }

    @Override
    public LineClassification classify(String line) {
        if (line == null || line.isBlank()) {
            return LineClassification.BLANK;
        }
        String stripped = line.strip();
        int[] codePoints = stripped.codePoints().toArray();

        int nonWhitespace = 0;
        int boxChars = 0;
        for (int codePoint : codePoints) {
            if (Character.isWhitespace(codePoint)) {
                continue;
            }
            nonWhitespace++;
            CharRole role = CharacterClassifier.classify(codePoint);
            if (role != CharRole.PLAIN) {
                boxChars++;
            }
        }

        int first = codePoints[0];
        int last = codePoints[codePoints.length - 1];
        boolean opens = CharacterClassifier.classify(first).isStructural();
        boolean closes = CharacterClassifier.classify(last).isStructural();

        if (boxChars * 2 > nonWhitespace
                || (opens && closes)
                || CharacterClassifier.isVerticalBorder(first)
                || hasEdgeAtEnds(codePoints)) {
            return LineClassification.DIAGRAM;
        }
        if (looksLikeCode(stripped)) {
            return LineClassification.CODE;
        }
        return LineClassification.PROSE;
    }

    @Override
    public Optional<SuffixBorder> detectSuffixBorder(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String trimmed = line.stripTrailing();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        int lastIndex = trimmed.offsetByCodePoints(trimmed.length(), -1);
        int last = trimmed.codePointAt(lastIndex);
        CharRole role = CharacterClassifier.classify(last);
        if (!role.isStructural()) {
            return Optional.empty();
        }
        int column = VisualWidth.of(trimmed.substring(0, lastIndex));
        return Optional.of(new SuffixBorder(column, last, role));
    }

    // A corner opening or closing the line next to a run of fills, as in "+-- a" or "b --+".
    private boolean hasEdgeAtEnds(int[] codePoints) {
        int last = codePoints.length - 1;
        return (CharacterClassifier.isCorner(codePoints[0]) && fillRun(codePoints, 1, 1) >= MIN_EDGE_FILLS)
                || (CharacterClassifier.isCorner(codePoints[last]) && fillRun(codePoints, last - 1, -1) >= MIN_EDGE_FILLS);
    }

    private int fillRun(int[] codePoints, int start, int step) {
        int run = 0;
        for (int i = start; i >= 0 && i < codePoints.length; i += step) {
            if (!CharacterClassifier.isHorizontalFill(codePoints[i])) {
                break;
            }
            run++;
        }
        return run;
    }

    private boolean looksLikeCode(String stripped) {
        boolean codeLike = CODE_KEYWORD.matcher(stripped).find()
                || CODE_TERMINATOR.matcher(stripped).find()
                || CODE_OPERATOR.matcher(stripped).find()
                || CODE_COMMENT.matcher(stripped).find();
        if (!codeLike) {
            return false;
        }
        boolean proseLike = SENTENCE_END.matcher(stripped).find() && PROSE_WORDS.matcher(stripped).find();
        return !proseLike;
    }
}
