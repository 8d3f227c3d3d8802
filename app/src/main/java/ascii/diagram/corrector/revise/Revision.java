package ascii.diagram.corrector.revise;

/**
 * A scored, insertion-only edit to one line of a diagram block.
 */
public sealed interface Revision permits PadBeforeSuffixBorder, AddSuffixBorder {

    /**
     * Index of the target line within its block.
     */
    int lineIndex();

    /**
     * Visual column the text is inserted at.
     */
    int column();

    /**
     * Text inserted at {@link #column()}.
     */
    String text();

    /**
     * Deterministic confidence in [0,1] that the edit is correct.
     */
    double score();

    /**
     * Returns {@code line} with the insertion performed. Existing characters are never removed or
     * reordered.
     *
     * @throws RevisionOutOfRangeException if the column is not a character boundary of {@code line}
     */
    String apply(String line);
}
