package ascii.diagram.corrector.revise;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class AddSuffixBorderTest {

    @Test
    void scoresStayBelowAnyPadding() {
        AddSuffixBorder strongest = new AddSuffixBorder(0, 5, " |", true, true);
        AddSuffixBorder weakest = new AddSuffixBorder(0, 5, " |", false, false);

        assertThat(strongest.score()).isCloseTo(0.55, within(1e-9));
        assertThat(weakest.score()).isCloseTo(0.35, within(1e-9));
        assertThat(strongest.score()).isLessThan(new PadBeforeSuffixBorder(0, 5, " ", 1, false).score());
    }

    @Test
    void appendsBorderAfterContent() {
        AddSuffixBorder revision = new AddSuffixBorder(0, 5, " |", true, true);

        assertThat(revision.apply("| abc")).isEqualTo("| abc |");
    }

    @Test
    void keepsZeroWidthMarksWithTheirBaseCharacter() {
        AddSuffixBorder revision = new AddSuffixBorder(0, 3, " |", true, true);

        assertThat(revision.apply("| e\u0301")).isEqualTo("| e\u0301 |");
    }

    @Test
    void rejectsInsertionInsideContent() {
        AddSuffixBorder revision = new AddSuffixBorder(0, 4, " |", true, true);

        Throwable thrown = catchThrowable(() -> revision.apply("| abcdef"));

        assertThat(thrown)
                .isInstanceOf(RevisionOutOfRangeException.class)
                .hasMessageContaining("column 4");
    }

    @Test
    void rejectsColumnBeyondLine() {
        AddSuffixBorder revision = new AddSuffixBorder(0, 12, "|", true, true);

        assertThat(catchThrowable(() -> revision.apply("| abc"))).isInstanceOf(RevisionOutOfRangeException.class);
    }
}
