package chorus.reaction;

import java.util.Objects;

/**
 * A reaction recognized in inbound text.
 *
 * @param emoji          canonical emoji to apply
 * @param targetFragment quoted text identifying the target, at most
 *                       {@value ReactionPatternDetector#MAX_FRAGMENT_LENGTH} chars; empty
 *                       for a bare emoji
 * @param form           which phrasing matched
 * @param rawPattern     the matched reaction token, e.g. {@code Loved} or {@code Reacted 😂 to}
 */
public record DetectedReaction(String emoji, String targetFragment, ReactionForm form, String rawPattern) {

  public DetectedReaction {
    Objects.requireNonNull(emoji, "emoji");
    Objects.requireNonNull(targetFragment, "targetFragment");
    Objects.requireNonNull(form, "form");
    Objects.requireNonNull(rawPattern, "rawPattern");
  }

  public boolean hasFragment() {
    return !targetFragment.isEmpty();
  }
}
