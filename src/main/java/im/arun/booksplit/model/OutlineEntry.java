package im.arun.booksplit.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One embedded bookmark, flattened in document order.
 * Level 0 is the top of the outline; pages are 1-based.
 */
@Data
@AllArgsConstructor
public class OutlineEntry {
    private String title;
    private int level;
    private int targetPage;
}
