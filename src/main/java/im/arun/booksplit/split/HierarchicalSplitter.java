package im.arun.booksplit.split;

import im.arun.booksplit.SplitFailureException;
import im.arun.booksplit.config.BookSplitConfig;
import im.arun.booksplit.model.TocNode;
import im.arun.booksplit.model.TocTree;
import im.arun.booksplit.pdf.DocumentHandle;
import im.arun.booksplit.util.TocTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * Writes one PDF per TOC node into a directory tree that mirrors the TOC.
 *
 * <p>A node without children becomes {@code <pos>_<title>.pdf}. A node with children
 * becomes a directory {@code <pos>_<title>/} holding the node's full range as
 * {@code <pos>_<title>.pdf} followed by its children, where a child's position is the
 * parent's position plus {@code .<index>}.</p>
 */
public class HierarchicalSplitter {
    private static final Logger logger = LoggerFactory.getLogger(HierarchicalSplitter.class);

    private final FileNameSanitizer sanitizer;

    public HierarchicalSplitter() {
        this(new BookSplitConfig());
    }

    public HierarchicalSplitter(BookSplitConfig config) {
        this.sanitizer = new FileNameSanitizer(config.getMaxFilenameLength());
    }

    /**
     * Split a resolved tree.
     *
     * @param handle       open source document
     * @param resolvedTree tree whose nodes all carry an end page
     * @param outputRoot   directory to write into, created when missing
     * @param progress     receives {@code floor(100 * written / total)} after every file
     * @return the files written
     * @throws SplitFailureException on the first node that cannot be written; earlier
     *                               files are left in place
     */
    public SplitResult split(DocumentHandle handle, TocTree resolvedTree, Path outputRoot, IntConsumer progress) {
        int totalFiles = TocTrees.countNodes(resolvedTree);
        logger.info("Splitting {} into {} files ({} leaves) under {}",
                handle.name(), totalFiles, TocTrees.countLeaves(resolvedTree), outputRoot);

        try {
            Files.createDirectories(outputRoot);
        } catch (IOException e) {
            throw new SplitFailureException(new TocNode(handle.name(), "", 1, handle.pageCount()), e);
        }

        Walk walk = new Walk(handle, totalFiles, progress == null ? percent -> { } : progress);
        walk.writeSiblings(resolvedTree.getChapters(), "", outputRoot);

        logger.info("Wrote {} files for {}", walk.written.size(), handle.name());
        return new SplitResult(outputRoot, walk.written);
    }

    private final class Walk {
        private final DocumentHandle handle;
        private final int totalFiles;
        private final IntConsumer progress;
        private final List<Path> written = new ArrayList<>();

        private Walk(DocumentHandle handle, int totalFiles, IntConsumer progress) {
            this.handle = handle;
            this.totalFiles = totalFiles;
            this.progress = progress;
        }

        private void writeSiblings(List<TocNode> nodes, String parentPosition, Path directory) {
            for (int i = 0; i < nodes.size(); i++) {
                TocNode node = nodes.get(i);
                String position = parentPosition.isEmpty()
                        ? String.valueOf(i + 1)
                        : parentPosition + "." + (i + 1);
                String baseName = sanitizer.nodeName(position, node.getTitle());

                if (node.hasChildren()) {
                    Path nodeDirectory = write(node, directory, baseName, true);
                    writeSiblings(node.getChildren(), position, nodeDirectory);
                } else {
                    write(node, directory, baseName, false);
                }
            }
        }

        /**
         * @return the directory holding the node's file, which is its own directory
         *         when {@code ownDirectory} is set
         */
        private Path write(TocNode node, Path parent, String baseName, boolean ownDirectory) {
            if (node.getStartPage() == null || node.getEndPage() == null) {
                throw new SplitFailureException(node,
                        new IllegalStateException("page range is not resolved"));
            }
            Path directory;
            Path file;
            try {
                directory = ownDirectory ? parent.resolve(baseName) : parent;
                file = directory.resolve(baseName + ".pdf");
                byte[] pdf = handle.extractPages(node.getStartPage(), node.getEndPage());
                Files.createDirectories(directory);
                Files.write(file, pdf);
            } catch (IOException | RuntimeException e) {
                throw new SplitFailureException(node, e);
            }

            written.add(file);
            logger.debug("Saved {} (pages {} to {})", file, node.getStartPage(), node.getEndPage());
            progress.accept((int) ((100L * written.size()) / totalFiles));
            return directory;
        }
    }
}
