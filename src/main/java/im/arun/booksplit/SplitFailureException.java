package im.arun.booksplit;

import im.arun.booksplit.model.TocNode;

/**
 * Thrown when writing the document for a single TOC node fails.
 * Files written before the failure are left on disk.
 */
public class SplitFailureException extends BookSplitException {

    private final transient TocNode node;

    public SplitFailureException(TocNode node, Throwable cause) {
        super(String.format("Failed to split '%s' (pages %s-%s): %s",
                node.getTitle(), node.getStartPage(), node.getEndPage(), cause.getMessage()), cause);
        this.node = node;
    }

    public TocNode getNode() {
        return node;
    }
}
