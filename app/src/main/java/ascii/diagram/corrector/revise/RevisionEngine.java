package ascii.diagram.corrector.revise;

import ascii.diagram.corrector.analysis.DefaultLineAnalyzer;
import ascii.diagram.corrector.analysis.LineAnalyzer;
import ascii.diagram.corrector.analysis.LineRecord;
import ascii.diagram.corrector.analysis.SuffixBorder;
import ascii.diagram.corrector.text.CharRole;
import ascii.diagram.corrector.text.CharacterClassifier;
import ascii.diagram.corrector.text.VisualWidth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Proposes and selects revisions that align the trailing borders of a block.
 *
 * <p>The block's border column is the rightmost trailing border among its diagram lines: insertion
 * alone can bring every shorter line up to it, never a longer one down. Only trailing borders within
 * the alignment tolerance of that column are treated as the outer border; a border further left
 * belongs to an inner box and is closed off separately.
 */
public class RevisionEngine {

    public static final int DEFAULT_ALIGNMENT_TOLERANCE = 8;

    private static final int DEFAULT_BORDER = '|';

    private final LineAnalyzer analyzer;
    private final int alignmentTolerance;

    public RevisionEngine() {
        this(new DefaultLineAnalyzer(), DEFAULT_ALIGNMENT_TOLERANCE);
    }

    public RevisionEngine(LineAnalyzer analyzer, int alignmentTolerance) {
        if (alignmentTolerance < 0) {
            throw new IllegalArgumentException("alignmentTolerance must be zero or greater");
        }
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.alignmentTolerance = alignmentTolerance;
    }

    public Optional<BlockGeometry> geometry(List<LineRecord> records) {
        OptionalInt borderColumn = records.stream()
                .filter(LineRecord::isDiagram)
                .map(LineRecord::suffixBorder)
                .flatMap(Optional::stream)
                .mapToInt(SuffixBorder::column)
                .max();
        if (borderColumn.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new BlockGeometry(borderColumn.getAsInt(), dominantBorder(records), dominantLeadingColumn(records)));
    }

    /**
     * Generates at most one candidate per line lacking a border at the block's border column.
     */
    public List<Revision> propose(List<LineRecord> records) {
        Optional<BlockGeometry> geometry = geometry(records);
        if (geometry.isEmpty()) {
            return List.of();
        }
        BlockGeometry target = geometry.get();
        List<Revision> revisions = new ArrayList<>();
        for (int index = 0; index < records.size(); index++) {
            LineRecord record = records.get(index);
            if (!record.isDiagram() || record.isTerminatedAt(target.borderColumn())) {
                continue;
            }
            Optional<SuffixBorder> outerBorder = analyzer.detectSuffixBorder(
                    record.content(), target.borderColumn(), alignmentTolerance);
            if (outerBorder.isPresent()) {
                padBefore(index, record, outerBorder.get(), target).ifPresent(revisions::add);
            } else if (record.suffixBorder().isEmpty() || hasInnerStructure(record)) {
                addBorder(index, records, target).ifPresent(revisions::add);
            }
        }
        return revisions;
    }

    /**
     * Keeps the candidates scoring at least {@code minScore}, one per line (highest score wins),
     * ordered by line.
     */
    public List<Revision> select(List<Revision> candidates, double minScore) {
        Map<Integer, Revision> byLine = new TreeMap<>();
        for (Revision candidate : candidates) {
            if (candidate.score() < minScore) {
                continue;
            }
            byLine.merge(candidate.lineIndex(), candidate,
                    (current, challenger) -> challenger.score() > current.score() ? challenger : current);
        }
        return List.copyOf(byLine.values());
    }

    private Optional<Revision> padBefore(int index, LineRecord record, SuffixBorder border, BlockGeometry target) {
        int deficit = target.borderColumn() - border.column();
        if (deficit <= 0) {
            return Optional.empty();
        }
        String padding = paddingUnit(record.content(), border).repeat(deficit);
        return Optional.of(new PadBeforeSuffixBorder(index, border.column(), padding, deficit, record.structuralStart()));
    }

    private Optional<Revision> addBorder(int index, List<LineRecord> records, BlockGeometry target) {
        LineRecord record = records.get(index);
        OptionalInt leading = record.leadingBorderColumn();
        if (leading.isEmpty() || target.leadingColumn().isEmpty()
                || leading.getAsInt() != target.leadingColumn().getAsInt()) {
            return Optional.empty();
        }
        int borderColumn = target.borderColumn();
        int column = record.contentWidth();
        if (column > borderColumn) {
            return Optional.empty();
        }
        String text = " ".repeat(borderColumn - column) + target.borderCharacter();
        boolean matchingBorder = record.content().strip().codePointAt(0) == target.borderCodePoint();
        boolean similarLength = column * 2 >= borderColumn || alignsWithNeighbour(records, index);
        return Optional.of(new AddSuffixBorder(index, column, text, matchingBorder, similarLength));
    }

    // Rows of an inner box line up with the row above or below: same width when open, or a closing
    // border sitting on a structural character of the neighbour.
    private boolean alignsWithNeighbour(List<LineRecord> records, int index) {
        LineRecord record = records.get(index);
        for (int neighbour : new int[] {index - 1, index + 1}) {
            if (neighbour < 0 || neighbour >= records.size() || !records.get(neighbour).isDiagram()) {
                continue;
            }
            LineRecord other = records.get(neighbour);
            boolean aligned = record.suffixBorder()
                    .map(border -> hasStructureAt(other.content(), border.column()))
                    .orElse(other.contentWidth() == record.contentWidth());
            if (aligned) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasStructureAt(String content, int column) {
        int current = 0;
        for (int i = 0; i < content.length() && current <= column; ) {
            int codePoint = content.codePointAt(i);
            if (current == column) {
                return CharacterClassifier.classify(codePoint).isStructural();
            }
            current += VisualWidth.of(codePoint);
            i += Character.charCount(codePoint);
        }
        return false;
    }

    // An opening border plus a closing one, and something structural between them.
    private boolean hasInnerStructure(LineRecord record) {
        return record.content().codePoints()
                .filter(codePoint -> CharacterClassifier.classify(codePoint).isStructural())
                .count() > 2;
    }

    // Edges such as "+---+" grow with their own fill character, everything else with spaces.
    private String paddingUnit(String content, SuffixBorder border) {
        if (border.role() == CharRole.VERTICAL_BORDER) {
            return " ";
        }
        String trimmed = content.stripTrailing();
        int borderIndex = trimmed.offsetByCodePoints(trimmed.length(), -1);
        if (borderIndex == 0) {
            return " ";
        }
        int previous = trimmed.codePointBefore(borderIndex);
        if (CharacterClassifier.isHorizontalFill(previous)) {
            return new String(Character.toChars(previous));
        }
        return " ";
    }

    private int dominantBorder(List<LineRecord> records) {
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        for (LineRecord record : records) {
            record.content().codePoints()
                    .filter(CharacterClassifier::isVerticalBorder)
                    .forEach(codePoint -> counts.merge(codePoint, 1, Integer::sum));
        }
        int best = DEFAULT_BORDER;
        int bestCount = 0;
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    private OptionalInt dominantLeadingColumn(List<LineRecord> records) {
        Map<Integer, Long> counts = new TreeMap<>();
        records.stream()
                .filter(LineRecord::isDiagram)
                .map(LineRecord::leadingBorderColumn)
                .filter(OptionalInt::isPresent)
                .forEach(column -> counts.merge(column.getAsInt(), 1L, Long::sum));
        return counts.entrySet().stream()
                .max(Comparator.<Map.Entry<Integer, Long>>comparingLong(Map.Entry::getValue)
                        .thenComparing(Map.Entry::getKey, Comparator.reverseOrder()))
                .map(entry -> OptionalInt.of(entry.getKey()))
                .orElse(OptionalInt.empty());
    }
}
