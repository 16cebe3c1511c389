package chorus.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A message sent by one roster member for delivery to everyone else.
 *
 * <p>Immutable once created except for {@code reactionSummary} and
 * {@code lastReactionUpdate}, which are owned by
 * {@link chorus.reaction.ReactionAggregator} and recomputed whenever a reaction on this
 * broadcast changes. Broadcasts are never deleted; the history backs target resolution.
 *
 * @param id                 ULID identifier
 * @param senderAddress      address of the author
 * @param senderName         display name of the author at send time
 * @param text               message body as typed by the author
 * @param createdAt          acceptance time
 * @param reactionSummary    rendered count summary, empty when no active reactions
 * @param lastReactionUpdate when the summary was last re-broadcast, or {@code null}
 */
public record Broadcast(
    String id,
    String senderAddress,
    String senderName,
    String text,
    Instant createdAt,
    String reactionSummary,
    Instant lastReactionUpdate) {

  public Broadcast {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(senderAddress, "senderAddress");
    Objects.requireNonNull(senderName, "senderName");
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(createdAt, "createdAt");
    reactionSummary = reactionSummary == null ? "" : reactionSummary;
  }

  public static Broadcast create(String id, String senderAddress, String senderName,
      String text, Instant createdAt) {
    return new Broadcast(id, senderAddress, senderName, text, createdAt, "", null);
  }

  public Broadcast withReactionSummary(String summary) {
    return new Broadcast(id, senderAddress, senderName, text, createdAt, summary, lastReactionUpdate);
  }

  public Broadcast withLastReactionUpdate(Instant at) {
    return new Broadcast(id, senderAddress, senderName, text, createdAt, reactionSummary, at);
  }

  public boolean hasReactionSummary() {
    return !reactionSummary.isEmpty();
  }
}
