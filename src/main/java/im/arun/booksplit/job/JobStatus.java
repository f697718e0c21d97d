package im.arun.booksplit.job;

/** Lifecycle state of a split job. */
public enum JobStatus {
    /** Accepted, waiting for a worker. */
    QUEUED,

    /** Resolving, splitting or archiving. */
    IN_PROGRESS,

    /** Archive written; see the job's output path. */
    COMPLETED,

    /** Stopped on an error; see the job's error message. */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
