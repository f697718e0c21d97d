package im.arun.booksplit;

/**
 * Thrown when a table of contents has no chapters to work with.
 */
public class EmptyTreeException extends BookSplitException {

    public EmptyTreeException(String message) {
        super(message);
    }
}
