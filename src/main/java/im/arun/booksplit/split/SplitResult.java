package im.arun.booksplit.split;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;

/**
 * Files written by one split, in the order they were written.
 */
@Data
@AllArgsConstructor
public class SplitResult {
    private Path outputRoot;
    private List<Path> files;
}
