package chorus.reaction;

import chorus.model.Broadcast;
import chorus.model.Reaction;
import chorus.model.ReactionAction;

import java.util.Objects;

/**
 * Result of applying one reaction.
 *
 * @param broadcast   the target with its recomputed summary
 * @param reaction    the reaction row as stored
 * @param action      what the application did
 * @param totalActive active reactions on the target afterwards
 * @param sendUpdate  whether the caller should re-send the summary now
 */
public record AggregationResult(Broadcast broadcast, Reaction reaction, ReactionAction action,
    int totalActive, boolean sendUpdate) {

  public AggregationResult {
    Objects.requireNonNull(broadcast, "broadcast");
    Objects.requireNonNull(reaction, "reaction");
    Objects.requireNonNull(action, "action");
  }

  public String summary() {
    return broadcast.reactionSummary();
  }
}
