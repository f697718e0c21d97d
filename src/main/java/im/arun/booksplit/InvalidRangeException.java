package im.arun.booksplit;

/**
 * Thrown when a page range falls outside {@code [1, pageCount]} or is inverted.
 */
public class InvalidRangeException extends BookSplitException {

    public InvalidRangeException(String message) {
        super(message);
    }
}
