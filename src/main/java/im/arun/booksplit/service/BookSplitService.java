package im.arun.booksplit.service;

import im.arun.booksplit.config.BookSplitConfig;
import im.arun.booksplit.job.SplitJob;
import im.arun.booksplit.job.SplitJobEngine;
import im.arun.booksplit.job.SplitJobStore;
import im.arun.booksplit.model.TocTree;
import im.arun.booksplit.pdf.DocumentHandle;
import im.arun.booksplit.toc.ContentPageTranslator;
import im.arun.booksplit.toc.TocExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Entry point for front ends: TOC extraction, job submission, polling and download.
 */
public class BookSplitService implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BookSplitService.class);

    private final TocExtractor tocExtractor;
    private final ContentPageTranslator translator;
    private final SplitJobEngine engine;

    public BookSplitService(BookSplitConfig config) {
        this(new TocExtractor(config), new SplitJobEngine(config, new SplitJobStore()));
    }

    public BookSplitService(TocExtractor tocExtractor, SplitJobEngine engine) {
        this.tocExtractor = tocExtractor;
        this.translator = new ContentPageTranslator();
        this.engine = engine;
    }

    /**
     * Bookmarks of the document, or a single chapter spanning it when it has none.
     */
    public TocTree extractToc(Path pdfPath) {
        return tocExtractor.extract(pdfPath);
    }

    /**
     * Start splitting with a caller supplied TOC. A TOC counted in content pages is
     * translated to absolute pages first. When {@code toc} is {@code null} the
     * document's own TOC is extracted and used.
     *
     * @return id to poll
     */
    public UUID submitSplit(Path pdfPath, TocTree toc) {
        DocumentHandle handle = DocumentHandle.open(pdfPath);
        TocTree effective;
        try {
            effective = toc == null ? tocExtractor.extract(handle) : translator.toAbsolute(toc);
        } catch (RuntimeException e) {
            handle.close();
            throw e;
        }
        UUID jobId = engine.submit(handle, effective);
        logger.info("Submitted split of {} as job {}", pdfPath.getFileName(), jobId);
        return jobId;
    }

    public SplitJob pollJob(UUID jobId) {
        return engine.getStatus(jobId);
    }

    public Path fetchOutput(UUID jobId) {
        return engine.getOutput(jobId);
    }

    public SplitJobEngine engine() {
        return engine;
    }

    /**
     * Page count and info-dictionary title of a document.
     */
    public DocumentInfo describe(Path pdfPath) {
        try (DocumentHandle handle = DocumentHandle.open(pdfPath)) {
            return new DocumentInfo(handle.name(), handle.metadataTitle(), handle.pageCount());
        }
    }

    @Override
    public void close() {
        engine.close();
    }
}
