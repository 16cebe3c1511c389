package chorus.reaction;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ReactionPatternDetectorTest {

  private final ReactionPatternDetector detector = new ReactionPatternDetector();

  @Test
  void verbFormMapsToFixedEmoji() {
    DetectedReaction r = detector.detect("Loved \"see you sunday\"").orElseThrow();
    assertEquals("❤️", r.emoji());
    assertEquals("see you sunday", r.targetFragment());
    assertEquals(ReactionForm.VERB, r.form());

    assertEquals("👍", detector.detect("Liked \"ok\"").orElseThrow().emoji());
    assertEquals("👎", detector.detect("Disliked \"ok\"").orElseThrow().emoji());
    assertEquals("‼️", detector.detect("Emphasized \"ok\"").orElseThrow().emoji());
    assertEquals("❓", detector.detect("Questioned \"ok\"").orElseThrow().emoji());
  }

  @Test
  void verbFormIgnoresCaseAndAcceptsCurlyQuotes() {
    DetectedReaction r = detector.detect("laughed  at “pizza night”").orElseThrow();
    assertEquals("😂", r.emoji());
    assertEquals("pizza night", r.targetFragment());
  }

  @Test
  void reactedForm() {
    DetectedReaction r = detector.detect("Reacted 🙏 to \"thanks everyone\"").orElseThrow();
    assertEquals("🙏", r.emoji());
    assertEquals("thanks everyone", r.targetFragment());
    assertEquals(ReactionForm.REACTED, r.form());
  }

  @Test
  void reactedFormWithoutEmojiIsNotAReaction() {
    assertEquals(Optional.empty(), detector.detect("Reacted strongly to \"the news\""));
  }

  @Test
  void bareEmoji() {
    DetectedReaction r = detector.detect("👍").orElseThrow();
    assertEquals("👍", r.emoji());
    assertEquals("", r.targetFragment());
    assertFalse(r.hasFragment());
    assertEquals(ReactionForm.BARE_EMOJI, r.form());

    assertEquals("❤️", detector.detect("❤️").orElseThrow().emoji());
  }

  @Test
  void emojiToForm() {
    DetectedReaction r = detector.detect("🔥 to 'the new song'").orElseThrow();
    assertEquals("🔥", r.emoji());
    assertEquals("the new song", r.targetFragment());
    assertEquals(ReactionForm.EMOJI_TO, r.form());
  }

  @Test
  void ordinaryTextIsNotAReaction() {
    assertEquals(Optional.empty(), detector.detect("STATS"));
    assertEquals(Optional.empty(), detector.detect("Loved it"));
    assertEquals(Optional.empty(), detector.detect("hello 👍"));
    assertEquals(Optional.empty(), detector.detect(""));
    assertEquals(Optional.empty(), detector.detect(null));
  }

  @Test
  void longFragmentIsTruncated() {
    String quoted = "x".repeat(150);
    DetectedReaction r = detector.detect("Liked \"" + quoted + "\"").orElseThrow();
    assertEquals(ReactionPatternDetector.MAX_FRAGMENT_LENGTH, r.targetFragment().length());
  }

  @Test
  void truncateKeepsSurrogatePairsWhole() {
    String fragment = "a".repeat(99) + "😀";
    String truncated = ReactionPatternDetector.truncate(fragment + "tail");
    assertEquals("a".repeat(99), truncated);
  }

  @Test
  void textPresentationHeartIsStoredLikeTheLovedHeart() {
    assertEquals("❤️", detector.detect("❤").orElseThrow().emoji());
    assertEquals("❤️", detector.detect("Reacted ❤ to \"dinner\"").orElseThrow().emoji());
    assertEquals("❤️", detector.detect("❤︎ to \"dinner\"").orElseThrow().emoji());
    assertEquals("‼️", detector.detect("‼").orElseThrow().emoji());
  }

  @Test
  void emojiPresentationCharactersDropTheSelector() {
    assertEquals("❓", detector.detect("❓️").orElseThrow().emoji());
    assertEquals("✅", detector.detect("✅️").orElseThrow().emoji());
  }

  @Test
  void longEmojiRunIsCutAtAnEmojiBoundary() {
    DetectedReaction r = detector.detect("🎉".repeat(40)).orElseThrow();
    assertEquals("🎉".repeat(32), r.emoji());
    assertEquals(ReactionForm.BARE_EMOJI, r.form());

    String flags = detector.detect("🇺🇸".repeat(17)).orElseThrow().emoji();
    assertEquals("🇺🇸".repeat(16), flags);

    String family = "👨‍👩‍👧‍👦";
    String families = detector.detect(family.repeat(10)).orElseThrow().emoji();
    assertTrue(families.length() <= ReactionPatternDetector.MAX_EMOJI_LENGTH);
    assertEquals(family.repeat(families.length() / family.length()), families);
  }

  @Test
  void skinToneStaysWithItsHand() {
    assertEquals("👍🏽👍🏽", detector.detect("👍🏽 👍🏽").orElseThrow().emoji());
  }
}
