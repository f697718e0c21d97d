package im.arun.booksplit;

/**
 * Base type for all failures raised by the split pipeline.
 *
 * <p>Messages are written to be shown to the end user as-is, for example as the
 * {@code error} of a failed job.</p>
 */
public class BookSplitException extends RuntimeException {

    public BookSplitException(String message) {
        super(message);
    }

    public BookSplitException(String message, Throwable cause) {
        super(message, cause);
    }
}
