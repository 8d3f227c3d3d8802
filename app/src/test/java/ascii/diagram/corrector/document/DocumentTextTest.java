package ascii.diagram.corrector.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class DocumentTextTest {

    @Test
    void parsesUnixDocumentWithTrailingNewline() {
        DocumentText document = DocumentText.parse("a\nb\n");

        assertThat(document.lines()).containsExactly("a", "b");
        assertThat(document.lineSeparator()).isEqualTo("\n");
        assertThat(document.trailingNewline()).isTrue();
        assertThat(document.render()).isEqualTo("a\nb\n");
    }

    @Test
    void keepsWindowsSeparatorsAndMissingFinalNewline() {
        DocumentText document = DocumentText.parse("a\r\nb");

        assertThat(document.lines()).containsExactly("a", "b");
        assertThat(document.lineSeparator()).isEqualTo("\r\n");
        assertThat(document.trailingNewline()).isFalse();
        assertThat(document.render()).isEqualTo("a\r\nb");
    }

    @Test
    void keepsTrailingEmptyLines() {
        DocumentText document = DocumentText.parse("a\n\n");

        assertThat(document.lines()).containsExactly("a", "");
        assertThat(document.render()).isEqualTo("a\n\n");
    }

    @Test
    void handlesEmptyAndNewlineOnlyContent() {
        assertThat(DocumentText.parse("").lines()).isEmpty();
        assertThat(DocumentText.parse("").render()).isEmpty();
        assertThat(DocumentText.parse("\n").lines()).containsExactly("");
        assertThat(DocumentText.parse("\n").render()).isEqualTo("\n");
    }

    @Test
    void keepsEachLineBreakInMixedDocuments() {
        DocumentText unixFirst = DocumentText.parse("| a\n| b\r\n| c\n");
        DocumentText windowsFirst = DocumentText.parse("| a\r\n| b\n| c");

        assertThat(unixFirst.lines()).containsExactly("| a", "| b", "| c");
        assertThat(unixFirst.lineBreaks()).containsExactly("\n", "\r\n", "\n");
        assertThat(unixFirst.render()).isEqualTo("| a\n| b\r\n| c\n");
        assertThat(windowsFirst.lines()).containsExactly("| a", "| b", "| c");
        assertThat(windowsFirst.lineSeparator()).isEqualTo("\r\n");
        assertThat(windowsFirst.trailingNewline()).isFalse();
        assertThat(windowsFirst.withLines(List.of("| a |", "| b |", "| c |")).render())
                .isEqualTo("| a |\r\n| b |\n| c |");
    }

    @Test
    void rejectsMissingBreakBeforeLastLine() {
        assertThatThrownBy(() -> new DocumentText(List.of("a", "b"), List.of("", "\n")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void replacementLinesKeepLayout() {
        DocumentText document = DocumentText.parse("a\r\nb\r\n").withLines(List.of("x", "y", "z"));

        assertThat(document.render()).isEqualTo("x\r\ny\r\nz\r\n");
    }
}
