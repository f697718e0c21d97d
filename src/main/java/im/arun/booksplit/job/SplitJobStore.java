package im.arun.booksplit.job;

import im.arun.booksplit.JobNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

/**
 * Process-scoped table of split jobs.
 *
 * <p>Updates to one job are atomic and serialized; a job that reached a terminal state
 * is never changed again. Entries are kept until the process ends.</p>
 */
public class SplitJobStore {
    private static final Logger logger = LoggerFactory.getLogger(SplitJobStore.class);

    private final ConcurrentMap<UUID, SplitJob> jobs = new ConcurrentHashMap<>();
    private final Clock clock;

    public SplitJobStore() {
        this(Clock.systemUTC());
    }

    public SplitJobStore(Clock clock) {
        this.clock = clock;
    }

    SplitJob create() {
        UUID id = UUID.randomUUID();
        SplitJob job = SplitJob.queued(id, clock.instant());
        jobs.put(id, job);
        return job;
    }

    /**
     * Apply {@code change} to the job. Terminal jobs are returned unchanged.
     *
     * @return the job after the update
     * @throws JobNotFoundException if the id is unknown
     */
    SplitJob update(UUID id, UnaryOperator<SplitJob> change) {
        SplitJob updated = jobs.computeIfPresent(id, (key, current) -> {
            if (current.getStatus().isTerminal()) {
                logger.warn("Ignoring update of job {} in terminal state {}", key, current.getStatus());
                return current;
            }
            return change.apply(current).toBuilder().updatedAt(clock.instant()).build();
        });
        if (updated == null) {
            throw new JobNotFoundException(id);
        }
        return updated;
    }

    public SplitJob get(UUID id) {
        return find(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    public Optional<SplitJob> find(UUID id) {
        return id == null ? Optional.empty() : Optional.ofNullable(jobs.get(id));
    }

    /**
     * All jobs, oldest first.
     */
    public List<SplitJob> list() {
        List<SplitJob> all = new ArrayList<>(jobs.values());
        all.sort(Comparator.comparing(SplitJob::getCreatedAt).thenComparing(job -> job.getId().toString()));
        return all;
    }

    public int size() {
        return jobs.size();
    }
}
