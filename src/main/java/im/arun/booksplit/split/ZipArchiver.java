package im.arun.booksplit.split;

import im.arun.booksplit.ArchiveFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Packages a split output tree into a single zip file.
 *
 * <p>Entries are named relative to the output root's parent directory, so the root
 * directory itself is the top entry of the archive. The source tree is left untouched.</p>
 */
public class ZipArchiver {
    private static final Logger logger = LoggerFactory.getLogger(ZipArchiver.class);

    /**
     * Archive into {@code <parent>/<root name>.zip}.
     */
    public Path archive(Path outputRoot) {
        return archive(outputRoot, outputRoot.getFileName() + ".zip");
    }

    /**
     * Archive into {@code <parent>/<archiveName>}.
     *
     * @throws ArchiveFailureException if the tree cannot be read or the archive cannot be written
     */
    public Path archive(Path outputRoot, String archiveName) {
        if (!Files.isDirectory(outputRoot)) {
            throw new ArchiveFailureException("Output directory does not exist: " + outputRoot, null);
        }
        Path base = outputRoot.toAbsolutePath().getParent();
        Path archivePath = base.resolve(archiveName);

        List<Path> paths;
        try (Stream<Path> walk = Files.walk(outputRoot)) {
            paths = walk.sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new ArchiveFailureException("Failed to read output directory " + outputRoot, e);
        }

        try (OutputStream out = Files.newOutputStream(archivePath);
             ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Path path : paths) {
                String entryName = toEntryName(base.relativize(path.toAbsolutePath()));
                if (Files.isDirectory(path)) {
                    zip.putNextEntry(new ZipEntry(entryName + "/"));
                    zip.closeEntry();
                } else {
                    zip.putNextEntry(new ZipEntry(entryName));
                    Files.copy(path, zip);
                    zip.closeEntry();
                }
            }
        } catch (IOException e) {
            throw new ArchiveFailureException("Failed to write archive " + archivePath + ": " + e.getMessage(), e);
        }

        logger.info("Archived {} entries from {} into {}", paths.size(), outputRoot, archivePath);
        return archivePath;
    }

    private static String toEntryName(Path relative) {
        StringBuilder name = new StringBuilder();
        for (Path part : relative) {
            if (name.length() > 0) {
                name.append('/');
            }
            name.append(part);
        }
        return name.toString();
    }
}
