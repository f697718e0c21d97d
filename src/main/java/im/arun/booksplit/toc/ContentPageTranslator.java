package im.arun.booksplit.toc;

import im.arun.booksplit.model.TocNode;
import im.arun.booksplit.model.TocTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a manually authored TOC whose pages count from the first content page
 * into absolute PDF pages: {@code absolute = contentStartPage + relative - 1}.
 */
public class ContentPageTranslator {

    /**
     * @return a new tree with absolute pages and {@code contentStartPage = 1};
     *         the input is returned unchanged when it is already absolute
     */
    public TocTree toAbsolute(TocTree tree) {
        int offset = tree.effectiveContentStartPage();
        if (offset < 1) {
            throw new IllegalArgumentException("content_start_page must be >= 1, got " + offset);
        }
        if (offset == 1) {
            return tree;
        }

        List<TocNode> chapters = new ArrayList<>();
        if (tree.getChapters() != null) {
            for (TocNode chapter : tree.getChapters()) {
                chapters.add(translate(chapter, offset));
            }
        }
        return new TocTree(chapters, 1);
    }

    private TocNode translate(TocNode node, int offset) {
        TocNode copy = new TocNode(
                node.getTitle(),
                node.getNumber(),
                shift(node.getStartPage(), offset),
                shift(node.getEndPage(), offset));
        if (node.getChildren() != null) {
            for (TocNode child : node.getChildren()) {
                copy.getChildren().add(translate(child, offset));
            }
        }
        return copy;
    }

    private static Integer shift(Integer relative, int offset) {
        return relative == null ? null : offset + relative - 1;
    }
}
