package ascii.diagram.corrector.document;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads UTF-8 documents from a file or an input stream, rejecting bytes that are not valid UTF-8.
 */
public class DocumentReader {

    public DocumentText read(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path must be provided");
        }
        try {
            return DocumentText.parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new DocumentIoException("Failed to read input file: " + path, ex);
        }
    }

    public DocumentText read(InputStream input) {
        if (input == null) {
            throw new IllegalArgumentException("input must be provided");
        }
        try {
            return DocumentText.parse(decode(input.readAllBytes()));
        } catch (IOException ex) {
            throw new DocumentIoException("Failed to read standard input", ex);
        }
    }

    // Malformed bytes fail the read the same way Files.readString does for a file.
    private static String decode(byte[] bytes) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }
}
