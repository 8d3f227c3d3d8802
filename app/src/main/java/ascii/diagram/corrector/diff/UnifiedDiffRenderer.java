package ascii.diagram.corrector.diff;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import org.eclipse.jgit.diff.DiffAlgorithm;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.diff.EditList;
import org.eclipse.jgit.diff.RawText;
import org.eclipse.jgit.diff.RawTextComparator;

/**
 * Renders the difference between an original and a corrected document in unified diff format.
 */
public class UnifiedDiffRenderer {

    private static final int DEFAULT_CONTEXT_LINES = 3;

    private final int contextLines;

    public UnifiedDiffRenderer() {
        this(DEFAULT_CONTEXT_LINES);
    }

    public UnifiedDiffRenderer(int contextLines) {
        if (contextLines < 0) {
            throw new IllegalArgumentException("contextLines must be zero or greater");
        }
        this.contextLines = contextLines;
    }

    /**
     * Returns the unified diff, or an empty string when both versions are identical.
     */
    public String render(String label, List<String> before, List<String> after) {
        Objects.requireNonNull(label, "label");
        RawText baseText = new RawText(toBytes(before));
        RawText newText = new RawText(toBytes(after));
        DiffAlgorithm algorithm = DiffAlgorithm.getAlgorithm(DiffAlgorithm.SupportedAlgorithm.HISTOGRAM);
        EditList edits = algorithm.diff(RawTextComparator.DEFAULT, baseText, newText);
        if (edits.isEmpty()) {
            return "";
        }

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (DiffFormatter formatter = new DiffFormatter(buffer)) {
            formatter.setContext(contextLines);
            formatter.format(edits, baseText, newText);
            formatter.flush();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to render diff for " + label, ex);
        }
        return "--- a/" + label + "\n"
                + "+++ b/" + label + "\n"
                + buffer.toString(StandardCharsets.UTF_8);
    }

    private byte[] toBytes(List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return new byte[0];
        }
        return (String.join("\n", lines) + "\n").getBytes(StandardCharsets.UTF_8);
    }
}
