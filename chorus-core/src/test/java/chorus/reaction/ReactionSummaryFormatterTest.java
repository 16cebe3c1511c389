package chorus.reaction;

import chorus.model.Reaction;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReactionSummaryFormatterTest {
  private static final Instant T = Instant.parse("2024-05-04T18:00:00Z");

  private static Reaction r(String reactor, String emoji, boolean active) {
    return Reaction.first("b1", reactor, reactor, emoji, T).withActive(active, T);
  }

  @Test
  void ordersByCountThenEmoji() {
    String summary = ReactionSummaryFormatter.format(List.of(
        r("a", "👍", true), r("b", "❤️", true), r("c", "❤️", true), r("d", "😂", true)));
    Map<String, Integer> counts = ReactionSummaryFormatter.countActive(List.of(
        r("a", "👍", true), r("b", "❤️", true), r("c", "❤️", true), r("d", "😂", true)));

    assertEquals(List.of("❤️", "👍", "😂"), List.copyOf(counts.keySet()));
    assertEquals("4 reactions: ❤️×2 👍 😂", summary);
  }

  @Test
  void inactiveReactionsAreNotCounted() {
    assertEquals("1 reaction: 👍",
        ReactionSummaryFormatter.format(List.of(r("a", "👍", true), r("b", "❤️", false))));
  }

  @Test
  void noActiveReactionsRendersEmpty() {
    assertEquals("", ReactionSummaryFormatter.format(List.of()));
    assertEquals("", ReactionSummaryFormatter.format(List.of(r("a", "👍", false))));
  }
}
