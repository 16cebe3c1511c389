package chorus.model;

import java.util.Objects;

/** Unique key of a {@link Reaction} row. */
public record ReactionKey(String broadcastId, String reactorAddress) {

  public ReactionKey {
    Objects.requireNonNull(broadcastId, "broadcastId");
    Objects.requireNonNull(reactorAddress, "reactorAddress");
  }
}
