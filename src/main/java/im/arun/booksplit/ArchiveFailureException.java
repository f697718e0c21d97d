package im.arun.booksplit;

/**
 * Thrown when packaging a split output tree into an archive fails.
 * The unarchived tree is still on disk.
 */
public class ArchiveFailureException extends BookSplitException {

    public ArchiveFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
