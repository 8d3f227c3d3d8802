package ascii.diagram.corrector.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A text document split into lines, remembering the break that ended each line so that it can be
 * reproduced byte for byte, mixed line endings included. Only the last line may have no break.
 */
public record DocumentText(List<String> lines, List<String> lineBreaks) {

    private static final String LF = "\n";
    private static final String CRLF = "\r\n";

    public DocumentText {
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        lineBreaks = List.copyOf(Objects.requireNonNull(lineBreaks, "lineBreaks"));
        if (lines.size() != lineBreaks.size()) {
            throw new IllegalArgumentException("Every line needs exactly one line break entry");
        }
        for (int i = 0; i < lineBreaks.size(); i++) {
            String lineBreak = lineBreaks.get(i);
            boolean last = i == lineBreaks.size() - 1;
            if (!lineBreak.equals(LF) && !lineBreak.equals(CRLF) && !(last && lineBreak.isEmpty())) {
                throw new IllegalArgumentException("Unsupported line break at line " + (i + 1));
            }
        }
    }

    public static DocumentText parse(String content) {
        Objects.requireNonNull(content, "content");
        List<String> lines = new ArrayList<>();
        List<String> breaks = new ArrayList<>();
        int start = 0;
        int newline;
        while ((newline = content.indexOf('\n', start)) >= 0) {
            boolean crlf = newline > start && content.charAt(newline - 1) == '\r';
            lines.add(content.substring(start, crlf ? newline - 1 : newline));
            breaks.add(crlf ? CRLF : LF);
            start = newline + 1;
        }
        if (start < content.length()) {
            lines.add(content.substring(start));
            breaks.add("");
        }
        return new DocumentText(lines, breaks);
    }

    /**
     * The break used by the first terminated line, {@code "\n"} when there is none.
     */
    public String lineSeparator() {
        return lineBreaks.stream().filter(lineBreak -> !lineBreak.isEmpty()).findFirst().orElse(LF);
    }

    public boolean trailingNewline() {
        return !lineBreaks.isEmpty() && !lineBreaks.get(lineBreaks.size() - 1).isEmpty();
    }

    /**
     * Replaces the lines, keeping each line's break when the line count is unchanged.
     */
    public DocumentText withLines(List<String> replacement) {
        Objects.requireNonNull(replacement, "replacement");
        if (replacement.size() == lines.size()) {
            return new DocumentText(replacement, lineBreaks);
        }
        List<String> breaks = new ArrayList<>(Collections.nCopies(replacement.size(), lineSeparator()));
        if (!breaks.isEmpty() && !trailingNewline()) {
            breaks.set(breaks.size() - 1, "");
        }
        return new DocumentText(replacement, breaks);
    }

    public String render() {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            builder.append(lines.get(i)).append(lineBreaks.get(i));
        }
        return builder.toString();
    }
}
