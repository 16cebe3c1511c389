package chorus.reaction;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes free-text reaction phrases produced by phone messaging apps.
 *
 * <p>Forms are tried in this order and the first match wins:
 * <ol>
 *   <li>{@code <Verb> "<text>"} with a fixed verb to emoji mapping</li>
 *   <li>{@code Reacted <emoji> to "<text>"}</li>
 *   <li>one or more emoji and nothing else</li>
 *   <li>{@code <emoji> to "<text>"}</li>
 * </ol>
 * Straight and curly single or double quotes are accepted. Emoji are returned in a
 * canonical form, so {@code ❤} and {@code ❤️} are the same reaction, and runs longer than
 * {@value #MAX_EMOJI_LENGTH} chars are cut at an emoji boundary. Stateless and thread-safe.
 */
public final class ReactionPatternDetector {
  public static final int MAX_FRAGMENT_LENGTH = 100;
  public static final int MAX_EMOJI_LENGTH = 64;

  private static final String QUOTE = "[\"'“”‘’]";
  private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL;

  private static final Map<String, String> VERB_EMOJI = Map.of(
      "loved", "❤️",
      "liked", "👍",
      "disliked", "👎",
      "laughed at", "😂",
      "emphasized", "‼️",
      "questioned", "❓");

  private static final Pattern VERB_FORM = Pattern.compile(
      "^(Loved|Liked|Disliked|Laughed\\s+at|Emphasized|Questioned)\\s+" + QUOTE + "(.+)" + QUOTE + "$", FLAGS);
  private static final Pattern REACTED_FORM = Pattern.compile(
      "^Reacted\\s+(\\S+)\\s+to\\s+" + QUOTE + "(.+)" + QUOTE + "$", FLAGS);
  private static final Pattern EMOJI_TO_FORM = Pattern.compile(
      "^(\\S+)\\s+to\\s+" + QUOTE + "(.+)" + QUOTE + "$", FLAGS);

  /**
   * @param text inbound message text, already trimmed
   * @return the detected reaction, or empty when the text should be treated as a broadcast
   */
  public Optional<DetectedReaction> detect(String text) {
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }

    Matcher verb = VERB_FORM.matcher(text);
    if (verb.matches()) {
      String token = verb.group(1);
      String key = token.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
      return Optional.of(new DetectedReaction(VERB_EMOJI.get(key), truncate(verb.group(2)),
          ReactionForm.VERB, token));
    }

    Matcher reacted = REACTED_FORM.matcher(text);
    if (reacted.matches()) {
      String emoji = Emoji.canonical(Emoji.extract(reacted.group(1)), MAX_EMOJI_LENGTH);
      if (!emoji.isEmpty()) {
        return Optional.of(new DetectedReaction(emoji, truncate(reacted.group(2)),
            ReactionForm.REACTED, "Reacted " + reacted.group(1) + " to"));
      }
    }

    if (Emoji.isEmojiOnly(text)) {
      String emoji = Emoji.canonical(text, MAX_EMOJI_LENGTH);
      if (!emoji.isEmpty()) {
        return Optional.of(new DetectedReaction(emoji, "", ReactionForm.BARE_EMOJI,
            Emoji.stripWhitespace(text)));
      }
    }

    Matcher emojiTo = EMOJI_TO_FORM.matcher(text);
    if (emojiTo.matches() && Emoji.isEmojiOnly(emojiTo.group(1))) {
      String emoji = Emoji.canonical(emojiTo.group(1), MAX_EMOJI_LENGTH);
      if (!emoji.isEmpty()) {
        return Optional.of(new DetectedReaction(emoji, truncate(emojiTo.group(2)),
            ReactionForm.EMOJI_TO, emojiTo.group(1) + " to"));
      }
    }

    return Optional.empty();
  }

  static String truncate(String fragment) {
    String trimmed = fragment.strip();
    if (trimmed.length() <= MAX_FRAGMENT_LENGTH) {
      return trimmed;
    }
    int end = MAX_FRAGMENT_LENGTH;
    // don't split a surrogate pair
    if (Character.isHighSurrogate(trimmed.charAt(end - 1))) {
      end--;
    }
    return trimmed.substring(0, end);
  }
}
