package im.arun.booksplit.util;

import im.arun.booksplit.model.TocNode;
import im.arun.booksplit.model.TocTree;

import java.util.List;

/**
 * Utility methods for walking TOC trees.
 */
public final class TocTrees {

    private TocTrees() {}

    /**
     * Count every node at every depth. This is also the number of files a split writes.
     */
    public static int countNodes(TocTree tree) {
        return tree == null ? 0 : countNodes(tree.getChapters());
    }

    public static int countNodes(List<TocNode> nodes) {
        if (nodes == null) {
            return 0;
        }
        int count = 0;
        for (TocNode node : nodes) {
            count += 1 + countNodes(node.getChildren());
        }
        return count;
    }

    /**
     * Count nodes without children.
     */
    public static int countLeaves(TocTree tree) {
        return tree == null ? 0 : countLeaves(tree.getChapters());
    }

    private static int countLeaves(List<TocNode> nodes) {
        if (nodes == null) {
            return 0;
        }
        int count = 0;
        for (TocNode node : nodes) {
            count += node.hasChildren() ? countLeaves(node.getChildren()) : 1;
        }
        return count;
    }

    /**
     * Depth of the deepest node; 1 for a flat list of chapters, 0 for an empty tree.
     */
    public static int depth(TocTree tree) {
        return tree == null ? 0 : depth(tree.getChapters());
    }

    private static int depth(List<TocNode> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            return 0;
        }
        int max = 0;
        for (TocNode node : nodes) {
            max = Math.max(max, depth(node.getChildren()));
        }
        return max + 1;
    }
}
