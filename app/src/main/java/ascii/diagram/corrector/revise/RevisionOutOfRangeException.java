package ascii.diagram.corrector.revise;

/**
 * Raised when a revision targets a column that does not exist on the line it is applied to.
 */
public class RevisionOutOfRangeException extends RuntimeException {

    public RevisionOutOfRangeException(String message) {
        super(message);
    }
}
