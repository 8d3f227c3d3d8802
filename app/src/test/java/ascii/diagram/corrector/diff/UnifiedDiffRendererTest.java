package ascii.diagram.corrector.diff;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.util.List;
import org.junit.jupiter.api.Test;

class UnifiedDiffRendererTest {

    private final UnifiedDiffRenderer renderer = new UnifiedDiffRenderer();

    @Test
    void rendersNothingForIdenticalDocuments() {
        List<String> lines = List.of("+--+", "|a |", "+--+");

        assertThat(renderer.render("doc.txt", lines, lines)).isEmpty();
    }

    @Test
    void rendersChangedLineWithContext() {
        String diff = renderer.render("doc.txt",
                List.of("+-------+", "| hi|", "+-------+"),
                List.of("+-------+", "| hi    |", "+-------+"));

        assertThat(diff).isEqualTo("--- a/doc.txt\n"
                + "+++ b/doc.txt\n"
                + "@@ -1,3 +1,3 @@\n"
                + " +-------+\n"
                + "-| hi|\n"
                + "+| hi    |\n"
                + " +-------+\n");
    }

    @Test
    void limitsContextToConfiguredLines() {
        String diff = new UnifiedDiffRenderer(0).render("doc.txt",
                List.of("top", "| x|", "bottom"),
                List.of("top", "| x  |", "bottom"));

        assertThat(diff).contains("-| x|\n", "+| x  |\n");
        assertThat(diff).doesNotContain(" top\n", " bottom\n");
    }

    @Test
    void rejectsNegativeContext() {
        Throwable thrown = catchThrowable(() -> new UnifiedDiffRenderer(-1));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class);
    }
}
