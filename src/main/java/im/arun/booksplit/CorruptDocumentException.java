package im.arun.booksplit;

/**
 * Thrown when the source bytes cannot be parsed as a PDF document.
 */
public class CorruptDocumentException extends BookSplitException {

    public CorruptDocumentException(String message) {
        super(message);
    }

    public CorruptDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
