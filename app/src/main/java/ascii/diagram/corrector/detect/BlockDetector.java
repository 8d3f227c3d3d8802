package ascii.diagram.corrector.detect;

import ascii.diagram.corrector.analysis.LineRecord;
import ascii.diagram.corrector.analysis.SuffixBorder;
import ascii.diagram.corrector.text.CharacterClassifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups analyzed lines into candidate diagram blocks and scores how likely each one is a diagram.
 *
 * <p>A run opens on a diagram line, or on any line holding a corner or junction, and keeps
 * extending through diagram lines and short gaps of other lines. Gap lines trailing the last
 * diagram line are not part of the block.
 */
public class BlockDetector {

    public static final int DEFAULT_GAP_TOLERANCE = 1;

    static final double DIAGRAM_FRACTION_WEIGHT = 0.45;
    static final double CORNER_PAIR_WEIGHT = 0.30;
    static final double COLUMN_CONSISTENCY_WEIGHT = 0.25;
    private static final double COLUMN_STDDEV_SCALE = 4.0;

    private static final Logger LOGGER = LoggerFactory.getLogger(BlockDetector.class);

    private final int gapTolerance;

    public BlockDetector() {
        this(DEFAULT_GAP_TOLERANCE);
    }

    public BlockDetector(int gapTolerance) {
        if (gapTolerance < 0) {
            throw new IllegalArgumentException("gapTolerance must be zero or greater");
        }
        this.gapTolerance = gapTolerance;
    }

    /**
     * Finds every block whose confidence reaches {@code minConfidence}.
     */
    public List<Block> detect(List<LineRecord> records, double minConfidence) {
        List<Block> blocks = new ArrayList<>();
        int index = 0;
        while (index < records.size()) {
            LineRecord record = records.get(index);
            if (!opensRun(record)) {
                index++;
                continue;
            }
            int start = index;
            int end = index;
            int gap = 0;
            int cursor = index + 1;
            while (cursor < records.size()) {
                if (records.get(cursor).isDiagram()) {
                    end = cursor;
                    gap = 0;
                } else if (++gap > gapTolerance) {
                    break;
                }
                cursor++;
            }

            List<LineRecord> run = records.subList(start, end + 1);
            double confidence = confidence(run);
            if (confidence >= minConfidence) {
                blocks.add(new Block(start, end, confidence, run));
                LOGGER.debug("Block at lines {}-{} accepted (confidence {})", start + 1, end + 1, format(confidence));
            } else {
                LOGGER.debug("Block at lines {}-{} dropped (confidence {} below {})",
                        start + 1, end + 1, format(confidence), format(minConfidence));
            }
            index = end + 1;
        }
        return blocks;
    }

    /**
     * Weighted combination of the share of diagram lines, the presence of a matched corner pair and
     * the consistency of trailing border columns, normalized to [0,1].
     */
    public double confidence(List<LineRecord> run) {
        long nonBlank = run.stream().filter(record -> !record.isBlank()).count();
        if (nonBlank == 0) {
            return 0.0;
        }
        long diagramLines = run.stream().filter(LineRecord::isDiagram).count();
        double diagramFraction = (double) diagramLines / nonBlank;
        double cornerPair = run.stream().anyMatch(record -> hasCornerPair(record.content())) ? 1.0 : 0.0;
        double consistency = columnConsistency(run);

        double score = DIAGRAM_FRACTION_WEIGHT * diagramFraction
                + CORNER_PAIR_WEIGHT * cornerPair
                + COLUMN_CONSISTENCY_WEIGHT * consistency;
        return Math.max(0.0, Math.min(1.0, score));
    }

    private boolean opensRun(LineRecord record) {
        if (record.isDiagram()) {
            return true;
        }
        return record.content().codePoints()
                .anyMatch(cp -> CharacterClassifier.isCorner(cp) || CharacterClassifier.isJunction(cp));
    }

    // Corner, one or more fills or junctions, corner: the top or bottom edge of a box.
    static boolean hasCornerPair(String line) {
        int[] codePoints = line.codePoints().toArray();
        int openedAt = -1;
        for (int i = 0; i < codePoints.length; i++) {
            int codePoint = codePoints[i];
            if (CharacterClassifier.isCorner(codePoint)) {
                if (openedAt >= 0 && i - openedAt > 1) {
                    return true;
                }
                openedAt = i;
            } else if (!CharacterClassifier.isHorizontalFill(codePoint) && !CharacterClassifier.isJunction(codePoint)) {
                openedAt = -1;
            }
        }
        return false;
    }

    private double columnConsistency(List<LineRecord> run) {
        List<Integer> columns = run.stream()
                .filter(LineRecord::isDiagram)
                .map(LineRecord::suffixBorder)
                .flatMap(Optional::stream)
                .map(SuffixBorder::column)
                .toList();
        if (columns.isEmpty()) {
            return 0.0;
        }
        double mean = columns.stream().mapToInt(Integer::intValue).average().orElse(0.0);
        double variance = columns.stream()
                .mapToDouble(column -> (column - mean) * (column - mean))
                .average()
                .orElse(0.0);
        return Math.max(0.0, 1.0 - Math.sqrt(variance) / COLUMN_STDDEV_SCALE);
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
