package chorus.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A reactor's emoji acknowledgment of a prior {@link Broadcast}.
 *
 * <p>There is exactly one row per {@code (broadcastId, reactorAddress)}: later reactions
 * from the same reactor mutate this row instead of inserting another one. An inactive row
 * is a removed reaction kept for toggle history. {@code processed} is the digest flag and
 * is independent of {@code active}; once set it is never cleared.
 */
public record Reaction(
    String broadcastId,
    String reactorAddress,
    String reactorName,
    String emoji,
    String previousEmoji,
    boolean active,
    boolean processed,
    Instant createdAt,
    Instant updatedAt) {

  public Reaction {
    Objects.requireNonNull(broadcastId, "broadcastId");
    Objects.requireNonNull(reactorAddress, "reactorAddress");
    Objects.requireNonNull(reactorName, "reactorName");
    Objects.requireNonNull(emoji, "emoji");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(updatedAt, "updatedAt");
  }

  /** Creates the first, active reaction of a reactor on a broadcast. */
  public static Reaction first(String broadcastId, String reactorAddress, String reactorName,
      String emoji, Instant now) {
    return new Reaction(broadcastId, reactorAddress, reactorName, emoji, null, true, false, now, now);
  }

  public Reaction withActive(boolean active, Instant now) {
    return new Reaction(broadcastId, reactorAddress, reactorName, emoji, previousEmoji,
        active, processed, createdAt, now);
  }

  /** Replaces the emoji, remembering the old one, and reactivates the row. */
  public Reaction withEmoji(String newEmoji, Instant now) {
    return new Reaction(broadcastId, reactorAddress, reactorName, newEmoji, emoji,
        true, processed, createdAt, now);
  }

  public ReactionKey key() {
    return new ReactionKey(broadcastId, reactorAddress);
  }
}
