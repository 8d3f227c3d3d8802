package ascii.diagram.corrector.detect;

import ascii.diagram.corrector.analysis.LineRecord;
import java.util.List;
import java.util.Objects;

/**
 * A contiguous run of lines believed to form one diagram.
 *
 * @param startLine index of the first line in the document
 * @param endLine index of the last line in the document, inclusive
 * @param confidence heuristic estimate in [0,1] that the run is a genuine diagram
 * @param records analyses of the contained lines, in document order
 */
public record Block(int startLine, int endLine, double confidence, List<LineRecord> records) {

    public Block {
        if (startLine < 0 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid block boundaries");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1]");
        }
        records = List.copyOf(Objects.requireNonNull(records, "records"));
        if (records.size() != endLine - startLine + 1) {
            throw new IllegalArgumentException("records must cover every line of the block");
        }
    }

    public int length() {
        return endLine - startLine + 1;
    }

    public List<String> lines() {
        return records.stream().map(LineRecord::content).toList();
    }

    public Block withRecords(List<LineRecord> replacement) {
        return new Block(startLine, endLine, confidence, replacement);
    }
}
