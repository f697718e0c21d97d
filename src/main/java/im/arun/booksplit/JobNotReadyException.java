package im.arun.booksplit;

import im.arun.booksplit.job.JobStatus;

import java.util.UUID;

public class JobNotReadyException extends BookSplitException {

    public JobNotReadyException(UUID jobId, JobStatus status) {
        super("Output for job " + jobId + " is not available, status is " + status);
    }
}
