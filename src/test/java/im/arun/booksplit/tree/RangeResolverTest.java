package im.arun.booksplit.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import im.arun.booksplit.EmptyTreeException;
import im.arun.booksplit.InvalidRangeException;
import im.arun.booksplit.model.TocNode;
import im.arun.booksplit.model.TocTree;
import im.arun.booksplit.util.TocTrees;
import org.junit.jupiter.api.Test;

class RangeResolverTest {

  private final RangeResolver resolver = new RangeResolver();

  private static TocNode node(String title, int start) {
    return new TocNode(title, null, start, null);
  }

  private static TocNode node(String title, int start, TocNode... children) {
    TocNode n = node(title, start);
    n.getChildren().addAll(List.of(children));
    return n;
  }

  private static TocTree tree(TocNode... chapters) {
    return new TocTree(new ArrayList<>(List.of(chapters)));
  }

  @Test
  void resolve_bookOutline_infersEndsFromSiblingsAndParent() {
    TocTree input = tree(node("Ch1", 1, node("1.1", 3)), node("Ch2", 10));

    TocTree resolved = resolver.resolve(input, 20);

    TocNode ch1 = resolved.getChapters().get(0);
    assertEquals(1, ch1.getStartPage());
    assertEquals(9, ch1.getEndPage());
    assertEquals(3, ch1.getChildren().get(0).getStartPage());
    assertEquals(9, ch1.getChildren().get(0).getEndPage());
    TocNode ch2 = resolved.getChapters().get(1);
    assertEquals(10, ch2.getStartPage());
    assertEquals(20, ch2.getEndPage());
  }

  @Test
  void resolve_doesNotModifyInput() {
    TocTree input = tree(node("Ch1", 1), node("Ch2", 5));

    resolver.resolve(input, 8);

    assertNull(input.getChapters().get(0).getEndPage());
    assertNull(input.getChapters().get(1).getEndPage());
  }

  @Test
  void resolve_isIdempotent() {
    TocTree input = tree(
        node("Ch1", 1, node("1.1", 2, node("1.1.1", 2), node("1.1.2", 4)), node("1.2", 6)),
        node("Ch2", 9),
        node("Ch3", 15, node("3.1", 16)));

    TocTree once = resolver.resolve(input, 30);
    TocTree twice = resolver.resolve(once, 30);

    assertEquals(once, twice);
  }

  @Test
  void resolve_isDeterministic() {
    TocTree input = tree(node("A", 1, node("a", 2)), node("B", 4));

    assertEquals(resolver.resolve(input, 10), resolver.resolve(input, 10));
  }

  @Test
  void resolve_sharedStartPage_collapsesToSinglePage() {
    TocTree input = tree(node("Ch1", 5), node("Ch2", 5), node("Ch3", 8));

    TocTree resolved = resolver.resolve(input, 10);

    assertEquals(5, resolved.getChapters().get(0).getEndPage());
    assertEquals(7, resolved.getChapters().get(1).getEndPage());
    assertEquals(10, resolved.getChapters().get(2).getEndPage());
  }

  @Test
  void resolve_explicitEndPastDocument_isClampedToLastPage() {
    TocNode ch = new TocNode("Ch1", "1", 1, 50);

    TocTree resolved = resolver.resolve(tree(ch), 12);

    assertEquals(12, resolved.getChapters().get(0).getEndPage());
  }

  @Test
  void resolve_explicitEndBeforeStart_collapsesToStart() {
    TocNode ch = new TocNode("Ch1", "1", 6, 2);

    TocTree resolved = resolver.resolve(tree(ch), 12);

    assertEquals(6, resolved.getChapters().get(0).getEndPage());
  }

  @Test
  void resolve_childOutsideParent_isClippedIntoParent() {
    TocNode child = new TocNode("overflow", "1.1", 3, 15);
    TocNode late = new TocNode("late", "1.2", 20, null);
    TocNode ch1 = node("Ch1", 2, child, late);
    TocTree input = tree(ch1, node("Ch2", 10));

    TocTree resolved = resolver.resolve(input, 20);

    TocNode r1 = resolved.getChapters().get(0);
    assertEquals(9, r1.getEndPage());
    assertEquals(9, r1.getChildren().get(0).getEndPage());
    assertEquals(9, r1.getChildren().get(1).getStartPage());
    assertEquals(9, r1.getChildren().get(1).getEndPage());
  }

  @Test
  void resolve_childGapBeforeFirstSubsection_isKeptOnParent() {
    TocTree input = tree(node("Ch1", 1, node("1.1", 4), node("1.2", 6)), node("Ch2", 9));

    TocNode ch1 = resolver.resolve(input, 12).getChapters().get(0);

    assertEquals(1, ch1.getStartPage());
    assertEquals(8, ch1.getEndPage());
    assertEquals(4, ch1.getChildren().get(0).getStartPage());
  }

  @Test
  void resolve_emptyTree_fails() {
    assertThrows(EmptyTreeException.class, () -> resolver.resolve(new TocTree(new ArrayList<>()), 5));
    assertThrows(EmptyTreeException.class, () -> resolver.resolve(null, 5));
  }

  @Test
  void resolve_missingOrNonPositiveStart_fails() {
    TocTree noStart = tree(new TocNode("x", "1", null, null));
    TocTree zero = tree(node("x", 0));

    assertThrows(InvalidRangeException.class, () -> resolver.resolve(noStart, 5));
    assertThrows(InvalidRangeException.class, () -> resolver.resolve(zero, 5));
    assertThrows(InvalidRangeException.class, () -> resolver.resolve(tree(node("x", 1)), 0));
  }

  @Test
  void resolve_randomSortedTrees_satisfyRangeInvariants() {
    Random random = new Random(42);
    for (int round = 0; round < 200; round++) {
      int totalPages = 1 + random.nextInt(300);
      TocTree input = new TocTree(randomSiblings(random, 1, totalPages, 0));
      if (input.isEmpty()) {
        continue;
      }

      TocTree resolved = resolver.resolve(input, totalPages);

      assertEquals(TocTrees.countNodes(input), TocTrees.countNodes(resolved));
      assertRanges(resolved.getChapters(), 1, totalPages);
      assertEquals(resolved, resolver.resolve(resolved, totalPages));
    }
  }

  private static void assertRanges(List<TocNode> siblings, int lower, int upper) {
    int previousStart = lower;
    int previousEnd = lower - 1;
    for (TocNode n : siblings) {
      int start = n.getStartPage();
      int end = n.getEndPage();
      assertTrue(lower <= start && start <= end && end <= upper,
          n.getTitle() + " [" + start + "," + end + "] outside [" + lower + "," + upper + "]");
      assertTrue(start >= previousStart, "siblings out of order at " + n.getTitle());
      // only a collapsed single-page sibling may share its page with the next one
      assertTrue(previousEnd <= Math.max(previousStart, start - 1),
          "siblings overlap at " + n.getTitle());
      previousStart = start;
      previousEnd = end;
      assertRanges(n.getChildren(), start, end);
    }
  }

  private static List<TocNode> randomSiblings(Random random, int from, int to, int depth) {
    List<TocNode> nodes = new ArrayList<>();
    int count = depth == 0 ? 1 + random.nextInt(6) : random.nextInt(4);
    int start = from;
    for (int i = 0; i < count && start <= to; i++) {
      TocNode n = new TocNode("n" + depth + "-" + i, null, start, null);
      nodes.add(n);
      int next = start + random.nextInt(Math.max(1, (to - from + 1) / 3) + 1);
      if (depth < 2) {
        n.getChildren().addAll(randomSiblings(random, start, Math.min(to, Math.max(start, next - 1)), depth + 1));
      }
      start = next;
    }
    return nodes;
  }
}
