package ascii.diagram.corrector.detect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import ascii.diagram.corrector.analysis.DefaultLineAnalyzer;
import ascii.diagram.corrector.analysis.LineRecord;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class BlockDetectorTest {

    private final DefaultLineAnalyzer analyzer = new DefaultLineAnalyzer();
    private final BlockDetector detector = new BlockDetector();

    @Test
    void findsBoxSurroundedByProse() {
        List<LineRecord> records = analyze(
                "Some introduction text here",
                "",
                "+-------+",
                "| hi|",
                "+-------+",
                "",
                "More prose follows the box");

        List<Block> blocks = detector.detect(records, 0.5);

        assertThat(blocks).hasSize(1);
        Block block = blocks.get(0);
        assertThat(block.startLine()).isEqualTo(2);
        assertThat(block.endLine()).isEqualTo(4);
        assertThat(block.lines()).containsExactly("+-------+", "| hi|", "+-------+");
        assertThat(block.confidence()).isGreaterThan(0.8);
    }

    @Test
    void bridgesSingleBlankLineBetweenBoxes() {
        List<LineRecord> records = analyze(
                "+--+",
                "|a |",
                "+--+",
                "",
                "+--+",
                "|b |",
                "+--+");

        List<Block> blocks = detector.detect(records, 0.5);

        assertThat(blocks).singleElement().satisfies(block -> {
            assertThat(block.startLine()).isZero();
            assertThat(block.endLine()).isEqualTo(6);
            assertThat(block.confidence()).isCloseTo(1.0, within(1e-9));
        });
    }

    @Test
    void splitsBoxesWhenGapToleranceIsZero() {
        List<LineRecord> records = analyze(
                "+--+",
                "|a |",
                "+--+",
                "",
                "+--+",
                "|b |",
                "+--+");

        List<Block> blocks = new BlockDetector(0).detect(records, 0.5);

        assertThat(blocks).extracting(Block::startLine).containsExactly(0, 4);
        assertThat(blocks).extracting(Block::endLine).containsExactly(2, 6);
    }

    @Test
    void splitsBoxesSeparatedByTwoGapLines() {
        List<LineRecord> records = analyze(
                "+--+",
                "|a |",
                "+--+",
                "",
                "",
                "+--+",
                "|b |",
                "+--+");

        assertThat(detector.detect(records, 0.5)).hasSize(2);
    }

    @Test
    void dropsRunsBelowConfidenceThreshold() {
        List<LineRecord> records = analyze("Heading", "-----", "Body text of the section");

        assertThat(detector.detect(records, 0.5)).isEmpty();
        assertThat(detector.detect(records, 0.0)).singleElement().satisfies(block -> {
            assertThat(block.startLine()).isEqualTo(1);
            assertThat(block.confidence()).isCloseTo(BlockDetector.DIAGRAM_FRACTION_WEIGHT, within(1e-9));
        });
    }

    @Test
    void ignoresDocumentsWithoutDiagrams() {
        List<LineRecord> records = analyze("Just prose.", "", "Still prose without boxes.");

        assertThat(detector.detect(records, 0.0)).isEmpty();
    }

    @Test
    void blankRunHasZeroConfidence() {
        assertThat(detector.confidence(analyze("", "  "))).isZero();
    }

    @Test
    void recognizesCornerPairs() {
        assertThat(BlockDetector.hasCornerPair("+--+")).isTrue();
        assertThat(BlockDetector.hasCornerPair("┌─┬─┐")).isTrue();
        assertThat(BlockDetector.hasCornerPair("  +=====+  ")).isTrue();
        assertThat(BlockDetector.hasCornerPair("++")).isFalse();
        assertThat(BlockDetector.hasCornerPair("+-- text --+")).isFalse();
        assertThat(BlockDetector.hasCornerPair("| plain |")).isFalse();
    }

    private List<LineRecord> analyze(String... lines) {
        return Arrays.stream(lines).map(analyzer::analyze).toList();
    }
}
