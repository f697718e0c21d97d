package im.arun.booksplit.job;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable snapshot of a split job. The store replaces the snapshot on every change.
 */
@Value
@Builder(toBuilder = true)
public class SplitJob {

    UUID id;
    JobStatus status;
    Integer progress;
    Path outputPath;
    String error;
    Instant createdAt;
    Instant updatedAt;

    static SplitJob queued(UUID id, Instant now) {
        return SplitJob.builder()
                .id(id)
                .status(JobStatus.QUEUED)
                .progress(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
