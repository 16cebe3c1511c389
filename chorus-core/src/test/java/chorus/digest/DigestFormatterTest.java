package chorus.digest;

import chorus.model.Broadcast;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DigestFormatterTest {
  private static final Instant T = Instant.parse("2024-05-04T18:00:00Z");

  private final DigestFormatter formatter = new DigestFormatter();

  private static DigestFormatter.Entry entry(String name, String text, Map<String, Integer> counts) {
    int total = counts.values().stream().mapToInt(Integer::intValue).sum();
    return new DigestFormatter.Entry(Broadcast.create(name, "+" + name, name, text, T), counts, total);
  }

  private static Map<String, Integer> counts(Object... pairs) {
    Map<String, Integer> m = new LinkedHashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      m.put((String) pairs[i], (Integer) pairs[i + 1]);
    }
    return m;
  }

  @Test
  void pauseDigest() {
    String text = formatter.formatPause(List.of(
        entry("Alice", "Game at noon", counts("👍", 1)),
        entry("Bob", "Pizza after", counts("❤️", 2, "😂", 1))));

    assertEquals("🔔 While things were quiet:\n"
        + "\nAlice: \"Game at noon\" 👍"
        + "\nBob: \"Pizza after\" ❤️×2 😂", text);
  }

  @Test
  void dailyDigestIsNumbered() {
    String text = formatter.formatDaily(List.of(
        entry("Bob", "Pizza after", counts("❤️", 2, "😂", 1)),
        entry("Cy", "Bus leaves 8am", counts("👍", 2))), 6);

    assertEquals("🌙 Today's reactions (6 reactions):\n"
        + "\n1. Bob: \"Pizza after\" ❤️×2 😂"
        + "\n2. Cy: \"Bus leaves 8am\" 👍×2", text);
  }

  @Test
  void singularReactionCount() {
    assertTrue(formatter.formatDaily(List.of(entry("Alice", "hi", counts("👍", 1))), 1)
        .startsWith("🌙 Today's reactions (1 reaction):\n"));
  }
}
