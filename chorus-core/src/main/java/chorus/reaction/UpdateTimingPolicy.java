package chorus.reaction;

import chorus.model.ReactionAction;

import java.time.Duration;
import java.util.Objects;

/**
 * Decides whether a reaction change is worth re-sending the broadcast's summary to the
 * roster. Returning {@code false} records the change without notifying anyone.
 *
 * @see DefaultUpdateTimingPolicy
 */
@FunctionalInterface
public interface UpdateTimingPolicy {

  boolean shouldSendUpdate(Context context);

  /**
   * Inputs to a timing decision.
   *
   * @param totalActive             active reactions on the broadcast after the change
   * @param action                  what the change did
   * @param sinceLastUpdate         time since the summary was last sent, or since the
   *                                broadcast was created if it never was
   * @param reactionsSinceLastUpdate reactions that landed inside that interval
   */
  record Context(int totalActive, ReactionAction action, Duration sinceLastUpdate,
      int reactionsSinceLastUpdate) {

    public Context {
      Objects.requireNonNull(action, "action");
      Objects.requireNonNull(sinceLastUpdate, "sinceLastUpdate");
    }
  }
}
