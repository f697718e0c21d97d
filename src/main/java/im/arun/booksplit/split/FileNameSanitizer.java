package im.arun.booksplit.split;

import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.text.Normalizer;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes TOC titles safe to use as file and directory names.
 *
 * <p>Names only contain characters the file system's name encoding can represent.
 * Accents are stripped first so {@code "Café"} becomes {@code "Cafe"} even under an
 * ASCII-only encoding; anything still unencodable is dropped. Lengths are counted in
 * code points, so a surrogate pair is never split.</p>
 */
public class FileNameSanitizer {
    private static final Logger logger = LoggerFactory.getLogger(FileNameSanitizer.class);

    private static final Pattern MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern ILLEGAL = Pattern.compile("[^\\p{L}\\p{N}._-]");
    private static final Pattern LEADING_DOTS = Pattern.compile("^\\.+");
    private static final String EMPTY_NAME = "section";

    /** Encoded-size cap for a base name, leaving room for an extension within the usual 255 bytes. */
    static final int MAX_ENCODED_BYTES = 240;

    private final int maxLength;
    private final Charset nameCharset;

    public FileNameSanitizer(int maxLength) {
        this(maxLength, fileSystemCharset());
    }

    FileNameSanitizer(int maxLength, Charset nameCharset) {
        if (maxLength < 8) {
            throw new IllegalArgumentException("maxLength must be at least 8, got " + maxLength);
        }
        this.maxLength = maxLength;
        this.nameCharset = nameCharset;
    }

    /**
     * Whitespace runs become underscores, anything but letters, digits, dot, dash and
     * underscore is dropped, and the result is cut to the maximum length.
     */
    public String sanitize(String title) {
        return sanitize(title, maxLength, MAX_ENCODED_BYTES);
    }

    /**
     * Base name (no extension) for a node: {@code "<position>_<title>"}, e.g. {@code "1.2_Setup"}.
     * The position prefix is never truncated, which keeps sibling names distinct.
     */
    public String nodeName(String position, String title) {
        int room = Math.max(1, maxLength - position.codePointCount(0, position.length()) - 1);
        int byteRoom = Math.max(1, MAX_ENCODED_BYTES - position.length() - 1);
        return position + "_" + sanitize(title, room, byteRoom);
    }

    private String sanitize(String title, int limit, int byteLimit) {
        String cleaned = title == null ? "" : title.trim();
        cleaned = Normalizer.normalize(cleaned, Normalizer.Form.NFD);
        cleaned = MARKS.matcher(cleaned).replaceAll("");
        cleaned = Normalizer.normalize(cleaned, Normalizer.Form.NFC);
        cleaned = WHITESPACE.matcher(cleaned).replaceAll("_");
        cleaned = ILLEGAL.matcher(cleaned).replaceAll("");
        cleaned = encodableOnly(cleaned, limit, byteLimit);
        cleaned = LEADING_DOTS.matcher(cleaned).replaceAll("");
        return cleaned.isEmpty() ? EMPTY_NAME.substring(0, Math.min(limit, EMPTY_NAME.length())) : cleaned;
    }

    /**
     * Keeps the encodable code points, stopping at {@code limit} code points or
     * {@code byteLimit} encoded bytes.
     */
    private String encodableOnly(String text, int limit, int byteLimit) {
        CharsetEncoder encoder = nameCharset.newEncoder();
        StringBuilder kept = new StringBuilder();
        int codePoints = 0;
        int bytes = 0;
        for (int i = 0; i < text.length() && codePoints < limit; ) {
            int codePoint = text.codePointAt(i);
            i += Character.charCount(codePoint);

            String single = new String(Character.toChars(codePoint));
            if (!encoder.canEncode(single)) {
                continue;
            }
            int size = single.getBytes(nameCharset).length;
            if (bytes + size > byteLimit) {
                break;
            }
            kept.append(single);
            codePoints++;
            bytes += size;
        }
        return kept.toString();
    }

    static Charset fileSystemCharset() {
        String jnu = System.getProperty("sun.jnu.encoding");
        if (jnu != null) {
            try {
                return Charset.forName(jnu);
            } catch (IllegalArgumentException e) {
                logger.warn("Unknown file name encoding {}, using {}", jnu, Charset.defaultCharset());
            }
        }
        return Charset.defaultCharset();
    }
}
