package im.arun.booksplit.tree;

import im.arun.booksplit.EmptyTreeException;
import im.arun.booksplit.InvalidRangeException;
import im.arun.booksplit.model.TocNode;
import im.arun.booksplit.model.TocTree;
import im.arun.booksplit.util.TocTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns a TOC with open-ended sections into one where every node has a concrete
 * page range.
 *
 * <p>Per sibling list, in order:</p>
 * <ol>
 *   <li>a missing end page becomes the next sibling's start page minus one;</li>
 *   <li>the last sibling inherits the parent's end page, or the document end at the root;</li>
 *   <li>an end page before the start page collapses to a single page;</li>
 *   <li>children are clipped to their parent's range.</li>
 * </ol>
 * A parent keeps its own range even when its children leave gaps.
 *
 * <p>The input tree is never modified. Resolving an already resolved tree returns an
 * equal tree.</p>
 */
public class RangeResolver {
    private static final Logger logger = LoggerFactory.getLogger(RangeResolver.class);

    /**
     * @param tree       TOC with absolute page numbers
     * @param totalPages page count of the document the TOC belongs to
     * @return a resolved deep copy of {@code tree}
     * @throws EmptyTreeException    if the tree has no chapters
     * @throws InvalidRangeException if a node has no start page or starts before page 1
     */
    public TocTree resolve(TocTree tree, int totalPages) {
        if (tree == null || tree.isEmpty()) {
            throw new EmptyTreeException("Table of contents has no chapters");
        }
        if (totalPages < 1) {
            throw new InvalidRangeException("Document has no pages");
        }

        TocTree resolved = tree.copy();
        resolveSiblings(resolved.getChapters(), null, totalPages);

        logger.debug("Resolved {} nodes against {} pages", TocTrees.countNodes(resolved), totalPages);
        return resolved;
    }

    private void resolveSiblings(List<TocNode> siblings, TocNode parent, int upperBound) {
        // Starts first, so a sibling's end is derived from the next sibling's final start.
        for (TocNode node : siblings) {
            Integer start = node.getStartPage();
            if (start == null) {
                throw new InvalidRangeException("Section '" + node.getTitle() + "' has no start page");
            }
            if (start < 1) {
                throw new InvalidRangeException(
                        "Section '" + node.getTitle() + "' starts at page " + start + ", pages are 1-based");
            }
            if (parent != null) {
                node.setStartPage(clamp(start, parent.getStartPage(), parent.getEndPage()));
            }
        }

        for (int i = 0; i < siblings.size(); i++) {
            TocNode node = siblings.get(i);
            int start = node.getStartPage();

            int end;
            if (node.getEndPage() != null) {
                end = node.getEndPage();
            } else if (i < siblings.size() - 1) {
                end = siblings.get(i + 1).getStartPage() - 1;
            } else {
                end = upperBound;
            }

            end = Math.min(end, upperBound);
            if (end < start) {
                end = start;
            }
            node.setEndPage(end);

            if (node.hasChildren()) {
                resolveSiblings(node.getChildren(), node, end);
            }
        }
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(value, max));
    }
}
