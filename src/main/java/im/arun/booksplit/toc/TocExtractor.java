package im.arun.booksplit.toc;

import im.arun.booksplit.config.BookSplitConfig;
import im.arun.booksplit.model.OutlineEntry;
import im.arun.booksplit.model.TocNode;
import im.arun.booksplit.model.TocTree;
import im.arun.booksplit.pdf.DocumentHandle;
import im.arun.booksplit.util.TocTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds a table of contents from a document's embedded bookmarks.
 *
 * <p>Documents without a usable outline get a single chapter covering every page,
 * so extraction never fails for a readable PDF.</p>
 */
public class TocExtractor {
    private static final Logger logger = LoggerFactory.getLogger(TocExtractor.class);

    private final int minTopLevelEntries;
    private final String fallbackTitle;
    private final boolean useDocumentNameForFallback;

    public TocExtractor() {
        this(new BookSplitConfig());
    }

    public TocExtractor(BookSplitConfig config) {
        this.minTopLevelEntries = Math.max(1, config.getMinTopLevelEntries());
        this.fallbackTitle = config.getFallbackTitle();
        this.useDocumentNameForFallback = config.isUseDocumentNameForFallback();
    }

    /**
     * Open, extract and close in one call.
     */
    public TocTree extract(Path pdfPath) {
        try (DocumentHandle handle = DocumentHandle.open(pdfPath)) {
            return extract(handle);
        }
    }

    /**
     * Extract the TOC of an open document. End pages of outline-derived nodes are left
     * unset; see {@link im.arun.booksplit.tree.RangeResolver}.
     */
    public TocTree extract(DocumentHandle handle) {
        List<OutlineEntry> outline = handle.readOutline();
        List<TocNode> chapters = buildTree(outline);

        if (chapters.size() < minTopLevelEntries) {
            logger.info("Outline of {} has {} top-level entries, using single-chapter fallback",
                    handle.name(), chapters.size());
            return fallback(handle);
        }

        TocTree tree = new TocTree(chapters);
        logger.info("Using built-in outline of {}: {} entries, {} chapters, depth {}",
                handle.name(), outline.size(), chapters.size(), TocTrees.depth(tree));
        return tree;
    }

    /**
     * Group a flat outline into a tree.
     * An entry becomes a child of the nearest preceding entry with a smaller level;
     * entries without one are chapters. Numbers are the 1-based sibling positions
     * joined by dots.
     */
    static List<TocNode> buildTree(List<OutlineEntry> outline) {
        List<TocNode> roots = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();

        for (OutlineEntry entry : outline) {
            while (!stack.isEmpty() && stack.peek().level >= entry.getLevel()) {
                stack.pop();
            }

            List<TocNode> siblings = stack.isEmpty() ? roots : stack.peek().node.getChildren();
            String number = stack.isEmpty()
                    ? String.valueOf(siblings.size() + 1)
                    : stack.peek().node.getNumber() + "." + (siblings.size() + 1);

            TocNode node = new TocNode(entry.getTitle(), number, entry.getTargetPage(), null);
            siblings.add(node);
            stack.push(new Frame(entry.getLevel(), node));
        }

        return roots;
    }

    private TocTree fallback(DocumentHandle handle) {
        String title = fallbackTitle;
        if (useDocumentNameForFallback && handle.name() != null && !handle.name().isBlank()) {
            title = handle.name();
        }
        TocNode chapter = new TocNode(title, "1", 1, handle.pageCount());
        List<TocNode> chapters = new ArrayList<>();
        chapters.add(chapter);
        return new TocTree(chapters);
    }

    private static final class Frame {
        private final int level;
        private final TocNode node;

        private Frame(int level, TocNode node) {
            this.level = level;
            this.node = node;
        }
    }
}
