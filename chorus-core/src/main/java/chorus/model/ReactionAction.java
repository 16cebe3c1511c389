package chorus.model;

/**
 * Outcome label of applying a reaction, used for confirmation text and update timing.
 */
public enum ReactionAction {
  ADDED("added"),
  REMOVED("removed"),
  CHANGED("changed");

  private final String label;

  ReactionAction(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
