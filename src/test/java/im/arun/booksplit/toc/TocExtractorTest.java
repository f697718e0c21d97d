package im.arun.booksplit.toc;

import static im.arun.booksplit.testsupport.TestPdfs.bookmark;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;

import im.arun.booksplit.config.BookSplitConfig;
import im.arun.booksplit.model.OutlineEntry;
import im.arun.booksplit.model.TocNode;
import im.arun.booksplit.model.TocTree;
import im.arun.booksplit.testsupport.TestPdfs;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TocExtractorTest {

  @TempDir
  Path tmp;

  @Test
  void extract_withoutBookmarks_fallsBackToSingleChapterNamedAfterDocument() throws Exception {
    Path pdf = TestPdfs.write(tmp.resolve("Learning_Docker.pdf"), 42);

    TocTree toc = new TocExtractor().extract(pdf);

    assertEquals(1, toc.getChapters().size());
    TocNode only = toc.getChapters().get(0);
    assertEquals("Learning_Docker", only.getTitle());
    assertEquals("1", only.getNumber());
    assertEquals(1, only.getStartPage());
    assertEquals(42, only.getEndPage());
    assertTrue(only.getChildren().isEmpty());
  }

  @Test
  void extract_fallbackTitleFromConfig_whenDocumentNameDisabled() throws Exception {
    Path pdf = TestPdfs.write(tmp.resolve("scan.pdf"), 3);
    BookSplitConfig config = new BookSplitConfig();
    config.setUseDocumentNameForFallback(false);
    config.setFallbackTitle("Whole Book");

    TocTree toc = new TocExtractor(config).extract(pdf);

    assertEquals("Whole Book", toc.getChapters().get(0).getTitle());
  }

  @Test
  void extract_tooFewTopLevelEntries_fallsBack() throws Exception {
    Path pdf = TestPdfs.write(tmp.resolve("thin.pdf"), 6, bookmark(0, "Only", 2));
    BookSplitConfig config = new BookSplitConfig();
    config.setMinTopLevelEntries(2);

    TocTree toc = new TocExtractor(config).extract(pdf);

    assertEquals(1, toc.getChapters().size());
    assertEquals("thin", toc.getChapters().get(0).getTitle());
    assertEquals(6, toc.getChapters().get(0).getEndPage());
  }

  @Test
  void extract_nestedBookmarks_buildsNumberedTreeWithOpenEnds() throws Exception {
    Path pdf = TestPdfs.write(tmp.resolve("book.pdf"), 20,
        bookmark(0, "Intro", 1),
        bookmark(0, "Basics", 5),
        bookmark(1, "Setup", 5),
        bookmark(2, "Linux", 6),
        bookmark(1, "Usage", 9),
        bookmark(0, "Advanced", 12));

    TocTree toc = new TocExtractor().extract(pdf);

    List<TocNode> chapters = toc.getChapters();
    assertEquals(3, chapters.size());
    assertEquals("Intro", chapters.get(0).getTitle());
    assertEquals("1", chapters.get(0).getNumber());
    assertNull(chapters.get(0).getEndPage(), "outline entries leave end pages to the resolver");

    TocNode basics = chapters.get(1);
    assertEquals("2", basics.getNumber());
    assertEquals(2, basics.getChildren().size());
    assertEquals("2.1", basics.getChildren().get(0).getNumber());
    assertEquals("2.1.1", basics.getChildren().get(0).getChildren().get(0).getNumber());
    assertEquals(6, basics.getChildren().get(0).getChildren().get(0).getStartPage());
    assertEquals("2.2", basics.getChildren().get(1).getNumber());

    assertEquals("3", chapters.get(2).getNumber());
    assertEquals(12, chapters.get(2).getStartPage());
  }

  @Test
  void buildTree_levelJump_attachesToNearestShallowerEntry() {
    List<TocNode> roots = TocExtractor.buildTree(List.of(
        new OutlineEntry("Part", 0, 1),
        new OutlineEntry("Deep", 2, 3),
        new OutlineEntry("Mid", 1, 4),
        new OutlineEntry("Next", 0, 7)));

    assertEquals(2, roots.size());
    TocNode part = roots.get(0);
    assertEquals(2, part.getChildren().size());
    assertEquals("Deep", part.getChildren().get(0).getTitle());
    assertEquals("1.1", part.getChildren().get(0).getNumber());
    assertEquals("Mid", part.getChildren().get(1).getTitle());
    assertEquals("1.2", part.getChildren().get(1).getNumber());
    assertEquals("2", roots.get(1).getNumber());
  }

  @Test
  void buildTree_entriesStartingBelowLevelZero_becomeChapters() {
    List<TocNode> roots = TocExtractor.buildTree(List.of(
        new OutlineEntry("A", 1, 1),
        new OutlineEntry("B", 1, 2)));

    assertEquals(2, roots.size());
    assertEquals("2", roots.get(1).getNumber());
  }

  @Test
  void buildTree_emptyOutline_isEmpty() {
    assertTrue(TocExtractor.buildTree(List.of()).isEmpty());
  }
}
