package ascii.diagram.corrector.correct;

import ascii.diagram.corrector.analysis.DefaultLineAnalyzer;
import ascii.diagram.corrector.analysis.LineAnalyzer;
import ascii.diagram.corrector.analysis.LineRecord;
import ascii.diagram.corrector.detect.Block;
import ascii.diagram.corrector.detect.BlockDetector;
import ascii.diagram.corrector.revise.RevisionEngine;
import ascii.diagram.corrector.text.TabExpander;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Corrects every diagram in a document: tab expansion, line analysis, block detection, one
 * correction loop per block and reassembly in document order.
 *
 * <p>Lines outside modified blocks are returned exactly as given, tabs included. A modified block
 * is returned in its tab-expanded form because its alignment was computed on expanded text.
 */
public class DiagramCorrector {

    private static final Logger LOGGER = LoggerFactory.getLogger(DiagramCorrector.class);

    private final LineAnalyzer analyzer;
    private final BlockDetector blockDetector;
    private final CorrectionLoop correctionLoop;

    public DiagramCorrector() {
        this(new DefaultLineAnalyzer(), new BlockDetector(), new RevisionEngine());
    }

    public DiagramCorrector(LineAnalyzer analyzer, BlockDetector blockDetector, RevisionEngine revisionEngine) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.blockDetector = Objects.requireNonNull(blockDetector, "blockDetector");
        this.correctionLoop = new CorrectionLoop(analyzer, Objects.requireNonNull(revisionEngine, "revisionEngine"));
    }

    public CorrectionResult correct(List<String> lines, CorrectionSettings settings) {
        Objects.requireNonNull(lines, "lines");
        Objects.requireNonNull(settings, "settings");

        TabExpander tabExpander = new TabExpander(settings.tabWidth());
        List<LineRecord> records = lines.stream()
                .map(tabExpander::expand)
                .map(analyzer::analyze)
                .toList();

        List<Block> blocks = blockDetector.detect(records, settings.blockThreshold());
        log(settings, "Found {} diagram block(s)", blocks.size());

        List<String> output = new ArrayList<>(lines);
        List<BlockReport> reports = new ArrayList<>();
        for (int i = 0; i < blocks.size(); i++) {
            Block block = blocks.get(i);
            log(settings, "Block {}: lines {}-{} (confidence: {}%)", i + 1, block.startLine() + 1, block.endLine() + 1,
                    String.format(Locale.ROOT, "%.0f", block.confidence() * 100));

            BlockOutcome outcome = correctionLoop.run(block, settings.maxIterations(), settings.minScore());
            if (outcome.modified()) {
                List<String> corrected = outcome.block().lines();
                for (int offset = 0; offset < corrected.size(); offset++) {
                    output.set(block.startLine() + offset, corrected.get(offset));
                }
            }
            log(settings, "Block {}: {} after {} iteration(s), {} revision(s) applied",
                    i + 1, describe(outcome.state()), outcome.iterations(), outcome.revisionsApplied());
            reports.add(BlockReport.from(outcome));
        }

        return new CorrectionResult(output, CorrectionReport.of(reports));
    }

    private static String describe(LoopState state) {
        return state == LoopState.CONVERGED ? "converged" : "iteration limit reached";
    }

    private static void log(CorrectionSettings settings, String format, Object... arguments) {
        if (settings.verbose()) {
            LOGGER.info(format, arguments);
        } else {
            LOGGER.debug(format, arguments);
        }
    }
}
