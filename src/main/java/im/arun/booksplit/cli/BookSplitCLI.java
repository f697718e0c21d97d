package im.arun.booksplit.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.booksplit.BookSplitException;
import im.arun.booksplit.config.BookSplitConfig;
import im.arun.booksplit.config.ConfigLoader;
import im.arun.booksplit.job.JobStatus;
import im.arun.booksplit.job.SplitJob;
import im.arun.booksplit.model.TocTree;
import im.arun.booksplit.service.BookSplitService;
import im.arun.booksplit.service.DocumentInfo;
import im.arun.booksplit.toc.TocJsonCodec;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Command-line interface for BookSplit using Picocli.
 */
@Command(
    name = "booksplit",
    description = "Split a PDF book into chapter PDFs following its table of contents",
    mixinStandardHelpOptions = true,
    version = "BookSplit 1.0",
    subcommands = {
        BookSplitCLI.TocCommand.class,
        BookSplitCLI.SplitCommand.class,
        BookSplitCLI.InfoCommand.class
    }
)
public class BookSplitCLI implements Runnable {

    @Option(names = {"--config"}, description = "Path to a config.yaml", scope = CommandLine.ScopeType.INHERIT)
    String configPath;

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    BookSplitConfig loadConfig(Map<String, Object> overrides) {
        return new ConfigLoader(configPath).load(overrides);
    }

    static Path validatePdf(String pdfPath) {
        Path path = Paths.get(pdfPath);
        if (!Files.exists(path)) {
            System.err.println("Error: PDF file not found: " + pdfPath);
            return null;
        }
        if (!pdfPath.toLowerCase().endsWith(".pdf")) {
            System.err.println("Error: File must be a PDF: " + pdfPath);
            return null;
        }
        return path;
    }

    @Command(name = "toc", description = "Print the table of contents as JSON")
    static class TocCommand implements Callable<Integer> {

        @CommandLine.ParentCommand
        BookSplitCLI parent;

        @Option(names = {"--pdf"}, description = "Path to PDF file", required = true)
        String pdfPath;

        @Option(names = {"--output"}, description = "Output JSON file path")
        String outputPath;

        @Override
        public Integer call() throws Exception {
            Path pdf = validatePdf(pdfPath);
            if (pdf == null) {
                return 1;
            }
            TocJsonCodec codec = new TocJsonCodec();

            try (BookSplitService service = new BookSplitService(parent.loadConfig(null))) {
                TocTree toc = service.extractToc(pdf);
                if (outputPath != null) {
                    codec.write(toc, Paths.get(outputPath));
                    System.out.println("TOC written to: " + outputPath);
                } else {
                    System.out.println(codec.write(toc));
                }
                return 0;
            } catch (BookSplitException e) {
                System.err.println("Error: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "split", description = "Split the PDF and archive the result")
    static class SplitCommand implements Callable<Integer> {

        @CommandLine.ParentCommand
        BookSplitCLI parent;

        @Option(names = {"--pdf"}, description = "Path to PDF file", required = true)
        String pdfPath;

        @Option(names = {"--toc"}, description = "TOC JSON to use instead of the document's bookmarks")
        String tocPath;

        @Option(names = {"--content-start-page"},
                description = "PDF page where content page 1 is printed; pages in --toc are content pages")
        Integer contentStartPage;

        @Option(names = {"--output-dir"}, description = "Directory for job output")
        String outputDir;

        @Option(names = {"--timeout-minutes"}, description = "Give up waiting after this long", defaultValue = "30")
        long timeoutMinutes;

        @Override
        public Integer call() throws Exception {
            Path pdf = validatePdf(pdfPath);
            if (pdf == null) {
                return 1;
            }

            Map<String, Object> overrides = new HashMap<>();
            if (outputDir != null) {
                overrides.put("output_directory", outputDir);
            }
            BookSplitConfig config = parent.loadConfig(overrides);

            try (BookSplitService service = new BookSplitService(config)) {
                TocTree toc = null;
                if (tocPath != null) {
                    toc = new TocJsonCodec().read(Paths.get(tocPath));
                    if (contentStartPage != null) {
                        toc.setContentStartPage(contentStartPage);
                    }
                }

                UUID jobId = service.submitSplit(pdf, toc);
                System.out.println("Job: " + jobId);

                SplitJob job = service.engine().awaitTermination(jobId, Duration.ofMinutes(timeoutMinutes));
                if (job.getStatus() == JobStatus.COMPLETED) {
                    System.out.println("Archive: " + service.fetchOutput(jobId));
                    return 0;
                }
                if (job.getStatus() == JobStatus.FAILED) {
                    System.err.println("Split failed: " + job.getError());
                } else {
                    System.err.println("Split did not finish in time, last status " + job.getStatus()
                            + " at " + job.getProgress() + "%");
                }
                return 1;
            } catch (BookSplitException | IllegalArgumentException e) {
                System.err.println("Error: " + e.getMessage());
                return 1;
            } catch (IOException e) {
                System.err.println("Error: cannot read TOC file " + tocPath + ": " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "info", description = "Print page count and title")
    static class InfoCommand implements Callable<Integer> {

        @CommandLine.ParentCommand
        BookSplitCLI parent;

        @Option(names = {"--pdf"}, description = "Path to PDF file", required = true)
        String pdfPath;

        @Override
        public Integer call() throws Exception {
            Path pdf = validatePdf(pdfPath);
            if (pdf == null) {
                return 1;
            }
            try (BookSplitService service = new BookSplitService(parent.loadConfig(null))) {
                DocumentInfo info = service.describe(pdf);
                ObjectMapper mapper = new ObjectMapper();
                mapper.enable(SerializationFeature.INDENT_OUTPUT);
                System.out.println(mapper.writeValueAsString(info));
                return 0;
            } catch (BookSplitException e) {
                System.err.println("Error: " + e.getMessage());
                return 1;
            }
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new BookSplitCLI()).execute(args);
        System.exit(exitCode);
    }
}
