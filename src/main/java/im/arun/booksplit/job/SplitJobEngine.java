package im.arun.booksplit.job;

import im.arun.booksplit.BookSplitException;
import im.arun.booksplit.EmptyTreeException;
import im.arun.booksplit.JobNotFoundException;
import im.arun.booksplit.JobNotReadyException;
import im.arun.booksplit.config.BookSplitConfig;
import im.arun.booksplit.model.TocTree;
import im.arun.booksplit.pdf.DocumentHandle;
import im.arun.booksplit.split.FileNameSanitizer;
import im.arun.booksplit.split.HierarchicalSplitter;
import im.arun.booksplit.split.ZipArchiver;
import im.arun.booksplit.tree.RangeResolver;
import im.arun.booksplit.util.ExecutorProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs resolve, split and archive as one background job per request.
 *
 * <p>{@link #submit} returns as soon as the job is queued. Callers poll
 * {@link #getStatus} until the job is {@link JobStatus#COMPLETED} or
 * {@link JobStatus#FAILED}; failures never escape the worker thread. There are no
 * retries, cancellation or timeouts.</p>
 *
 * <p>Output of job {@code id} for a document named {@code name} goes to
 * {@code <outputBase>/<id>/<name>/} with the archive next to it as
 * {@code <outputBase>/<id>/<id>.zip}.</p>
 */
public class SplitJobEngine implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SplitJobEngine.class);

    /** Share of the progress bar given to splitting; the rest covers archiving. */
    static final int SPLIT_PROGRESS_SHARE = 95;

    private final SplitJobStore store;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final Path outputBase;
    private final RangeResolver resolver;
    private final HierarchicalSplitter splitter;
    private final ZipArchiver archiver;
    private final FileNameSanitizer sanitizer;
    private final ConcurrentMap<UUID, CompletableFuture<Void>> running = new ConcurrentHashMap<>();

    public SplitJobEngine(BookSplitConfig config, SplitJobStore store) {
        this(config, store,
                ExecutorProvider.newWorkerPool(config.getWorkerThreads(), "booksplit-worker"), true,
                new RangeResolver(), new HierarchicalSplitter(config), new ZipArchiver());
    }

    public SplitJobEngine(BookSplitConfig config,
                          SplitJobStore store,
                          ExecutorService executor,
                          boolean ownsExecutor,
                          RangeResolver resolver,
                          HierarchicalSplitter splitter,
                          ZipArchiver archiver) {
        this.store = store;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        this.outputBase = Paths.get(config.getOutputDirectory());
        this.resolver = resolver;
        this.splitter = splitter;
        this.archiver = archiver;
        this.sanitizer = new FileNameSanitizer(config.getMaxFilenameLength());
    }

    /**
     * Open the document and queue a split. Open failures are thrown here, before a job
     * exists.
     *
     * @throws im.arun.booksplit.CorruptDocumentException if the file is not a readable PDF
     * @throws EmptyTreeException                         if the TOC has no chapters
     */
    public UUID submit(Path pdfPath, TocTree toc) {
        requireChapters(toc);
        return submit(DocumentHandle.open(pdfPath), toc);
    }

    /**
     * Queue a split of an already opened document. The engine takes ownership of the
     * handle and closes it when the job ends, or right away if the job is rejected.
     *
     * @return the new job's id
     */
    public UUID submit(DocumentHandle handle, TocTree toc) {
        try {
            requireChapters(toc);
        } catch (EmptyTreeException e) {
            handle.close();
            throw e;
        }

        TocTree snapshot = toc.copy();
        SplitJob job = store.create();
        UUID id = job.getId();
        logger.info("Queued split job {} for {} ({} chapters)", id, handle.name(), snapshot.getChapters().size());

        try {
            CompletableFuture<Void> future = CompletableFuture.runAsync(() -> run(id, handle, snapshot), executor);
            running.put(id, future);
            future.whenComplete((ignored, ex) -> running.remove(id));
        } catch (RejectedExecutionException e) {
            handle.close();
            store.update(id, current -> current.toBuilder()
                    .status(JobStatus.FAILED)
                    .error("Job could not be scheduled: engine is shut down")
                    .build());
            logger.error("Split job {} rejected by executor", id, e);
        }
        return id;
    }

    /**
     * @throws JobNotFoundException if no job has this id
     */
    public SplitJob getStatus(UUID jobId) {
        return store.get(jobId);
    }

    /**
     * @return the archive of a completed job
     * @throws JobNotFoundException if no job has this id
     * @throws JobNotReadyException unless the job completed
     */
    public Path getOutput(UUID jobId) {
        SplitJob job = store.get(jobId);
        if (job.getStatus() != JobStatus.COMPLETED || job.getOutputPath() == null) {
            throw new JobNotReadyException(jobId, job.getStatus());
        }
        return job.getOutputPath();
    }

    public List<SplitJob> listJobs() {
        return store.list();
    }

    /**
     * Block until the job is terminal or the timeout passes.
     *
     * @return the latest snapshot, terminal unless the wait timed out
     */
    public SplitJob awaitTermination(UUID jobId, Duration timeout) throws InterruptedException {
        SplitJob job = store.get(jobId);
        CompletableFuture<Void> future = running.get(jobId);
        if (job.getStatus().isTerminal() || future == null) {
            return store.get(jobId);
        }
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            logger.debug("Worker of job {} ended exceptionally", jobId, e);
        } catch (TimeoutException e) {
            logger.debug("Timed out waiting for job {}", jobId);
        }
        return store.get(jobId);
    }

    private void run(UUID id, DocumentHandle handle, TocTree toc) {
        try (DocumentHandle document = handle) {
            store.update(id, job -> job.toBuilder().status(JobStatus.IN_PROGRESS).progress(0).build());
            logger.info("Split job {} started", id);

            int totalPages = document.pageCount();
            TocTree resolved = resolver.resolve(toc, totalPages);

            Path jobDirectory = outputBase.resolve(id.toString());
            Path bookDirectory = jobDirectory.resolve(sanitizer.sanitize(document.name()));
            splitter.split(document, resolved, bookDirectory,
                    percent -> reportProgress(id, percent * SPLIT_PROGRESS_SHARE / 100));

            Path archive = archiver.archive(bookDirectory, id + ".zip");
            store.update(id, job -> job.toBuilder()
                    .status(JobStatus.COMPLETED)
                    .progress(100)
                    .outputPath(archive)
                    .build());
            logger.info("Split job {} completed: {}", id, archive);
        } catch (Exception e) {
            fail(id, e);
        } catch (Error e) {
            fail(id, e);
            throw e;
        }
    }

    private void fail(UUID id, Throwable cause) {
        logger.error("Split job {} failed: {}", id, cause.getMessage(), cause);
        store.update(id, job -> job.toBuilder()
                .status(JobStatus.FAILED)
                .error(describe(cause))
                .build());
    }

    private void reportProgress(UUID id, int progress) {
        store.update(id, job -> {
            int current = job.getProgress() == null ? 0 : job.getProgress();
            return progress > current ? job.toBuilder().progress(progress).build() : job;
        });
    }

    private static void requireChapters(TocTree toc) {
        if (toc == null || toc.isEmpty()) {
            throw new EmptyTreeException("No table of contents available for splitting");
        }
    }

    private static String describe(Throwable e) {
        if (e instanceof BookSplitException && e.getMessage() != null) {
            return e.getMessage();
        }
        String message = e.getMessage();
        return message == null || message.isBlank()
                ? e.getClass().getSimpleName()
                : e.getClass().getSimpleName() + ": " + message;
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            ExecutorProvider.shutdown(executor, 60);
        }
    }
}
