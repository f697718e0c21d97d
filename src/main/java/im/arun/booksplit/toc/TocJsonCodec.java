package im.arun.booksplit.toc;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.booksplit.model.TocTree;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

/**
 * Reads and writes the TOC wire format:
 * {@code {"chapters": [{"title", "number", "page", "end_page", "subtopics": [...]}]}}.
 */
public class TocJsonCodec {
    private final ObjectMapper objectMapper;

    public TocJsonCodec() {
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public TocTree read(String json) {
        try {
            return normalize(objectMapper.readValue(json, TocTree.class));
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed TOC JSON: " + e.getMessage(), e);
        }
    }

    public TocTree read(Path jsonFile) throws IOException {
        return read(Files.readString(jsonFile));
    }

    public String write(TocTree tree) {
        try {
            return objectMapper.writeValueAsString(tree);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void write(TocTree tree, Path jsonFile) throws IOException {
        Files.writeString(jsonFile, write(tree));
    }

    private TocTree normalize(TocTree tree) {
        if (tree.getChapters() == null) {
            tree.setChapters(new ArrayList<>());
        }
        if (tree.getContentStartPage() == null) {
            tree.setContentStartPage(1);
        }
        return tree;
    }
}
