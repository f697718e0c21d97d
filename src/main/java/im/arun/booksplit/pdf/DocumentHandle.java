package im.arun.booksplit.pdf;

import im.arun.booksplit.BookSplitException;
import im.arun.booksplit.CorruptDocumentException;
import im.arun.booksplit.InvalidRangeException;
import im.arun.booksplit.model.OutlineEntry;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.multipdf.PageExtractor;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Owns one opened PDF document.
 *
 * <p>Read operations may be called from several threads; the handle must not be
 * shared between jobs. Always release it with try-with-resources.</p>
 */
public class DocumentHandle implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DocumentHandle.class);

    private final PDDocument document;
    private final String name;
    private volatile boolean closed;

    private DocumentHandle(PDDocument document, String name) {
        this.document = document;
        this.name = name;
    }

    /**
     * Open a PDF file.
     *
     * @param pdfPath path to the PDF file
     * @return an open handle
     * @throws CorruptDocumentException if the file is missing, empty, encrypted or not a PDF
     */
    public static DocumentHandle open(Path pdfPath) {
        if (!Files.isRegularFile(pdfPath)) {
            throw new CorruptDocumentException("PDF file not found: " + pdfPath);
        }
        try {
            PDDocument document = Loader.loadPDF(pdfPath.toFile());
            logger.info("Opened {} ({} pages)", pdfPath.getFileName(), document.getNumberOfPages());
            return new DocumentHandle(document, stripExtension(pdfPath.getFileName().toString()));
        } catch (InvalidPasswordException e) {
            throw new CorruptDocumentException("PDF is encrypted and cannot be opened: " + pdfPath, e);
        } catch (IOException e) {
            throw new CorruptDocumentException("Invalid or corrupted PDF file " + pdfPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Open a PDF held in memory.
     *
     * @param pdfBytes PDF file content
     * @param name     document name used for output naming, usually the upload's file name
     */
    public static DocumentHandle open(byte[] pdfBytes, String name) {
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new CorruptDocumentException("PDF file is empty");
        }
        try {
            PDDocument document = Loader.loadPDF(pdfBytes);
            logger.info("Opened {} from memory ({} pages)", name, document.getNumberOfPages());
            return new DocumentHandle(document, stripExtension(name));
        } catch (InvalidPasswordException e) {
            throw new CorruptDocumentException("PDF is encrypted and cannot be opened: " + name, e);
        } catch (IOException e) {
            throw new CorruptDocumentException("Invalid or corrupted PDF file " + name + ": " + e.getMessage(), e);
        }
    }

    public int pageCount() {
        ensureOpen();
        return document.getNumberOfPages();
    }

    /**
     * Document name without extension, e.g. {@code "Learning_Docker"} for {@code Learning_Docker.pdf}.
     */
    public String name() {
        return name;
    }

    /**
     * Title from the PDF info dictionary, or {@code null} when absent or blank.
     */
    public String metadataTitle() {
        ensureOpen();
        PDDocumentInformation info = document.getDocumentInformation();
        String title = info == null ? null : info.getTitle();
        return title == null || title.isBlank() ? null : title.trim();
    }

    /**
     * Build a standalone PDF holding pages {@code start..end} (1-based, inclusive).
     * Page resources such as fonts and images travel with the pages; bookmarks do not.
     *
     * @throws InvalidRangeException if the range is inverted or outside the document
     */
    public byte[] extractPages(int start, int end) {
        ensureOpen();
        int total = document.getNumberOfPages();
        if (start < 1 || end < start || end > total) {
            throw new InvalidRangeException(
                    String.format("Invalid page range %d-%d for a document with %d pages", start, end, total));
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        synchronized (document) {
            try (PDDocument part = new PageExtractor(document, start, end).extract()) {
                part.save(out);
            } catch (IOException e) {
                throw new BookSplitException(
                        String.format("Could not extract pages %d-%d: %s", start, end, e.getMessage()), e);
            }
        }
        return out.toByteArray();
    }

    /**
     * Flatten the embedded bookmarks in document order.
     *
     * <p>A bookmark whose destination cannot be resolved keeps the previous bookmark's
     * page (page 1 for the first one), so the entry still lands in the tree.</p>
     *
     * @return bookmarks with level 0 at the top, or an empty list when there are none
     */
    public List<OutlineEntry> readOutline() {
        ensureOpen();
        PDDocumentOutline outline = document.getDocumentCatalog().getDocumentOutline();
        List<OutlineEntry> entries = new ArrayList<>();
        if (outline == null) {
            return entries;
        }
        synchronized (document) {
            collectOutline(outline, 0, entries);
        }
        logger.debug("Read {} outline entries from {}", entries.size(), name);
        return entries;
    }

    private void collectOutline(PDOutlineNode parent, int level, List<OutlineEntry> entries) {
        for (PDOutlineItem item : parent.children()) {
            int page = resolvePage(item);
            if (page < 1) {
                page = entries.isEmpty() ? 1 : entries.get(entries.size() - 1).getTargetPage();
            }
            String title = item.getTitle() == null ? "" : item.getTitle().trim();
            entries.add(new OutlineEntry(title, level, page));
            collectOutline(item, level + 1, entries);
        }
    }

    private int resolvePage(PDOutlineItem item) {
        try {
            PDPage page = item.findDestinationPage(document);
            if (page == null) {
                return -1;
            }
            int index = document.getPages().indexOf(page);
            return index < 0 ? -1 : index + 1;
        } catch (IOException e) {
            logger.warn("Could not resolve destination of bookmark '{}': {}", item.getTitle(), e.getMessage());
            return -1;
        }
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            document.close();
            logger.debug("Closed {}", name);
        } catch (IOException e) {
            logger.error("Error closing PDF {}", name, e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Document " + name + " is already closed");
        }
    }

    private static String stripExtension(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return "document";
        }
        int dotIndex = fileName.lastIndexOf('.');
        return dotIndex > 0 ? fileName.substring(0, dotIndex) : fileName;
    }
}
