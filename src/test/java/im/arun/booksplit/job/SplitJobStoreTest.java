package im.arun.booksplit.job;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import im.arun.booksplit.JobNotFoundException;
import org.junit.jupiter.api.Test;

class SplitJobStoreTest {

  private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
  private final SplitJobStore store = new SplitJobStore(clock);

  @Test
  void create_startsQueuedAtZeroProgress() {
    SplitJob job = store.create();

    assertEquals(JobStatus.QUEUED, job.getStatus());
    assertEquals(0, job.getProgress());
    assertEquals(clock.instant(), job.getCreatedAt());
    assertSame(job, store.get(job.getId()));
  }

  @Test
  void update_replacesSnapshot() {
    SplitJob job = store.create();

    SplitJob updated = store.update(job.getId(), j -> j.toBuilder().status(JobStatus.IN_PROGRESS).progress(40).build());

    assertEquals(JobStatus.IN_PROGRESS, updated.getStatus());
    assertEquals(40, store.get(job.getId()).getProgress());
    assertEquals(JobStatus.QUEUED, job.getStatus(), "old snapshots are immutable");
  }

  @Test
  void update_terminalJob_isNeverChangedAgain() {
    SplitJob job = store.create();
    store.update(job.getId(), j -> j.toBuilder().status(JobStatus.FAILED).error("boom").build());

    SplitJob after = store.update(job.getId(), j -> j.toBuilder().status(JobStatus.COMPLETED).progress(100).build());

    assertEquals(JobStatus.FAILED, after.getStatus());
    assertEquals("boom", after.getError());
    assertEquals(after, store.get(job.getId()));
  }

  @Test
  void unknownId_isNotFound() {
    UUID unknown = UUID.randomUUID();

    assertThrows(JobNotFoundException.class, () -> store.get(unknown));
    assertThrows(JobNotFoundException.class, () -> store.update(unknown, j -> j));
    assertTrue(store.find(unknown).isEmpty());
    assertTrue(store.find(null).isEmpty());
  }

  @Test
  void list_returnsAllJobs() {
    SplitJob a = store.create();
    SplitJob b = store.create();

    List<SplitJob> all = store.list();

    assertEquals(2, all.size());
    assertTrue(all.contains(a) && all.contains(b));
    assertEquals(2, store.size());
  }
}
