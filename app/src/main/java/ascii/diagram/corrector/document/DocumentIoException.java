package ascii.diagram.corrector.document;

/**
 * Runtime exception for failures reading or writing documents.
 */
public class DocumentIoException extends RuntimeException {

    public DocumentIoException(String message) {
        super(message);
    }

    public DocumentIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
