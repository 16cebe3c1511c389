package chorus.reaction;

import chorus.model.Broadcast;

import java.util.Objects;

/**
 * Broadcast chosen as a reaction's target.
 *
 * @param broadcast the target
 * @param score     similarity score of the target, {@code 0} for a fallback
 * @param fallback  {@code true} when no candidate cleared the threshold (or the fragment
 *                  was empty) and the most recent candidate was used
 */
public record ResolvedTarget(Broadcast broadcast, double score, boolean fallback) {

  public ResolvedTarget {
    Objects.requireNonNull(broadcast, "broadcast");
  }
}
