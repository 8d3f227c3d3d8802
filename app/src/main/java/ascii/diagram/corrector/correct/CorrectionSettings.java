package ascii.diagram.corrector.correct;

/**
 * Options recognized by the correction engine.
 *
 * @param maxIterations upper bound on revising passes per block
 * @param minScore minimum revision score, and minimum block confidence unless low-confidence blocks are included
 * @param tabWidth tab stop distance used when expanding tabs
 * @param includeLowConfidence process every detected block regardless of its confidence
 * @param verbose report per-block progress at info level
 */
public record CorrectionSettings(
        int maxIterations,
        double minScore,
        int tabWidth,
        boolean includeLowConfidence,
        boolean verbose
) {

    public static final int DEFAULT_MAX_ITERATIONS = 10;
    public static final double DEFAULT_MIN_SCORE = 0.5;
    public static final int DEFAULT_TAB_WIDTH = 4;

    public CorrectionSettings {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive");
        }
        if (Double.isNaN(minScore) || minScore < 0.0 || minScore > 1.0) {
            throw new IllegalArgumentException("minScore must be within [0,1]");
        }
        if (tabWidth <= 0) {
            throw new IllegalArgumentException("tabWidth must be positive");
        }
    }

    public static CorrectionSettings defaults() {
        return new CorrectionSettings(DEFAULT_MAX_ITERATIONS, DEFAULT_MIN_SCORE, DEFAULT_TAB_WIDTH, false, false);
    }

    public double blockThreshold() {
        return includeLowConfidence ? 0.0 : minScore;
    }
}
