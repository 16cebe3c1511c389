package chorus.reaction;

/**
 * Code point classification for emoji reaction tokens.
 *
 * <p>Covers the pictographic blocks used by phone keyboards plus the joiners, variation
 * selectors and tag characters that compose multi-code-point emoji.
 */
final class Emoji {

  static boolean isEmojiOnly(String text) {
    if (text == null || text.isBlank()) {
      return false;
    }
    boolean sawPictograph = false;
    int i = 0;
    while (i < text.length()) {
      int cp = text.codePointAt(i);
      i += Character.charCount(cp);
      if (Character.isWhitespace(cp)) {
        continue;
      }
      if (isPictographic(cp)) {
        sawPictograph = true;
      } else if (!isComponent(cp)) {
        return false;
      }
    }
    return sawPictograph;
  }

  /**
   * Returns the emoji code points of {@code token} in order, or an empty string when the
   * token has no pictographic character.
   */
  static String extract(String token) {
    StringBuilder sb = new StringBuilder();
    boolean sawPictograph = false;
    int i = 0;
    while (i < token.length()) {
      int cp = token.codePointAt(i);
      i += Character.charCount(cp);
      if (isPictographic(cp)) {
        sawPictograph = true;
        sb.appendCodePoint(cp);
      } else if (isComponent(cp) && sb.length() > 0) {
        sb.appendCodePoint(cp);
      }
    }
    return sawPictograph ? sb.toString() : "";
  }

  static String stripWhitespace(String text) {
    StringBuilder sb = new StringBuilder(text.length());
    text.codePoints()
        .filter(cp -> !Character.isWhitespace(cp))
        .forEach(sb::appendCodePoint);
    return sb.toString();
  }

  /**
   * Returns the stored form of an emoji run: whitespace removed, the presentation selector
   * normalized, and cut at an emoji boundary so the result is at most {@code maxChars} chars.
   *
   * <p>BMP pictographs whose default presentation is text ({@code ❤}, {@code ‼}, {@code ☀})
   * always carry U+FE0F; those that default to emoji ({@code ❓}, {@code ✅}) never do. In the
   * supplementary planes a U+FE0F is kept only where the sender wrote it.
   */
  static String canonical(String run, int maxChars) {
    StringBuilder sb = new StringBuilder(run.length() + 4);
    int clusterStart = 0;
    int regionalIndicators = 0;
    int prev = -1;
    int i = 0;
    while (i < run.length()) {
      int cp = run.codePointAt(i);
      i += Character.charCount(cp);
      if (Character.isWhitespace(cp) || cp == 0xFE0E) {
        continue;
      }
      if (cp == 0xFE0F) {
        if (prev >= 0x10000 && isPictographic(prev)) {
          sb.append((char) cp);
        }
        prev = cp;
        continue;
      }
      if (startsCluster(cp, prev, regionalIndicators)) {
        if (sb.length() > maxChars) {
          sb.setLength(clusterStart);
          return sb.toString();
        }
        clusterStart = sb.length();
      }
      if (isRegionalIndicator(cp)) {
        regionalIndicators++;
      }
      sb.appendCodePoint(cp);
      if (cp < 0x10000 && isPictographic(cp) && !isEmojiPresentation(cp)) {
        sb.append((char) 0xFE0F);
      }
      prev = cp;
    }
    if (sb.length() > maxChars) {
      sb.setLength(clusterStart);
    }
    return sb.toString();
  }

  private static boolean startsCluster(int cp, int prev, int regionalIndicators) {
    if (!isPictographic(cp) || prev == 0x200D || isSkinTone(cp)) {
      return false;
    }
    // a flag is two regional indicators
    return !isRegionalIndicator(cp) || regionalIndicators % 2 == 0;
  }

  private static boolean isSkinTone(int cp) {
    return cp >= 0x1F3FB && cp <= 0x1F3FF;
  }

  private static boolean isRegionalIndicator(int cp) {
    return cp >= 0x1F1E6 && cp <= 0x1F1FF;
  }

  // BMP code points with Emoji_Presentation=Yes
  private static boolean isEmojiPresentation(int cp) {
    return (cp >= 0x231A && cp <= 0x231B) || (cp >= 0x23E9 && cp <= 0x23EC)
        || cp == 0x23F0 || cp == 0x23F3 || (cp >= 0x25FD && cp <= 0x25FE)
        || (cp >= 0x2614 && cp <= 0x2615) || (cp >= 0x2648 && cp <= 0x2653)
        || cp == 0x267F || cp == 0x2693 || cp == 0x26A1 || (cp >= 0x26AA && cp <= 0x26AB)
        || (cp >= 0x26BD && cp <= 0x26BE) || (cp >= 0x26C4 && cp <= 0x26C5)
        || cp == 0x26CE || cp == 0x26D4 || cp == 0x26EA || (cp >= 0x26F2 && cp <= 0x26F3)
        || cp == 0x26F5 || cp == 0x26FA || cp == 0x26FD || cp == 0x2705
        || (cp >= 0x270A && cp <= 0x270B) || cp == 0x2728 || cp == 0x274C || cp == 0x274E
        || (cp >= 0x2753 && cp <= 0x2755) || cp == 0x2757 || (cp >= 0x2795 && cp <= 0x2797)
        || cp == 0x27B0 || cp == 0x27BF || (cp >= 0x2B1B && cp <= 0x2B1C)
        || cp == 0x2B50 || cp == 0x2B55;
  }

  private static boolean isPictographic(int cp) {
    return (cp >= 0x1F000 && cp <= 0x1FAFF)
        || (cp >= 0x2600 && cp <= 0x27BF)
        || (cp >= 0x2300 && cp <= 0x23FF)
        || (cp >= 0x2B00 && cp <= 0x2BFF)
        || (cp >= 0x2194 && cp <= 0x21AA)
        || (cp >= 0x25AA && cp <= 0x25FE)
        || (cp >= 0x2934 && cp <= 0x2935)
        || cp == 0x203C || cp == 0x2049 || cp == 0x2122 || cp == 0x2139
        || cp == 0x3030 || cp == 0x303D || cp == 0x3297 || cp == 0x3299
        || cp == 0x00A9 || cp == 0x00AE;
  }

  // variation selectors, zero-width joiner, keycap, tag sequences
  private static boolean isComponent(int cp) {
    return cp == 0xFE0F || cp == 0xFE0E || cp == 0x200D || cp == 0x20E3
        || (cp >= 0xE0020 && cp <= 0xE007F);
  }

  private Emoji() {}
}
