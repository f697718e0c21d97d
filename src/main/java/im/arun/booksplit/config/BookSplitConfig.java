package im.arun.booksplit.config;

import lombok.Data;

@Data
public class BookSplitConfig {
    private String outputDirectory = "outputs";
    private int workerThreads = 4;
    private int maxFilenameLength = 120;
    private int minTopLevelEntries = 1;
    private String fallbackTitle = "Document";
    private boolean useDocumentNameForFallback = true;
}
