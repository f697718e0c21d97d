package im.arun.booksplit;

import java.util.UUID;

public class JobNotFoundException extends BookSplitException {

    public JobNotFoundException(UUID jobId) {
        super("Job not found: " + jobId);
    }
}
