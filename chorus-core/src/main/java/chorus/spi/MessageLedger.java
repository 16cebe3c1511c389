package chorus.spi;

import chorus.model.Broadcast;
import chorus.model.DeliveryAttempt;
import chorus.model.Reaction;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for broadcasts, reactions and delivery outcomes.
 *
 * <p>Broadcasts are append-only. Reactions are keyed by {@code (broadcastId, reactorAddress)};
 * {@link #upsertReaction} replaces the row for that key and never creates a second one.
 * All methods may throw {@link StoreUnavailableException}.
 */
public interface MessageLedger {

  /**
   * Appends a new broadcast.
   *
   * @param broadcast the broadcast to store
   * @return the stored id
   */
  String saveBroadcast(Broadcast broadcast);

  Optional<Broadcast> findBroadcast(String broadcastId);

  /**
   * Returns broadcasts created at or after {@code since}, newest first.
   *
   * @param since         lower bound on {@code createdAt}
   * @param excludeSender sender whose broadcasts are skipped, or {@code null}
   * @param limit         maximum number of rows
   * @return matching broadcasts ordered by {@code createdAt} descending
   */
  List<Broadcast> recentBroadcasts(Instant since, String excludeSender, int limit);

  void updateSummary(String broadcastId, String summary);

  /**
   * Records when the reaction summary of a broadcast was last sent to the roster.
   */
  void markSummaryBroadcast(String broadcastId, Instant at);

  Optional<Reaction> getReaction(String broadcastId, String reactorAddress);

  /**
   * Inserts the reaction or replaces the existing row with the same key.
   */
  void upsertReaction(Reaction reaction);

  /**
   * Returns the active reactions on one broadcast.
   */
  List<Reaction> activeReactions(String broadcastId);

  /**
   * Returns reactions not yet included in any digest, created at or after {@code since}.
   * Both active and inactive rows are returned; callers filter.
   */
  List<Reaction> unprocessedReactions(Instant since);

  /**
   * Sets the processed flag on the given reactions. Already processed rows are left as is.
   *
   * @return number of rows changed
   */
  int markProcessed(Collection<Reaction> reactions);

  void saveDeliveryAttempts(List<DeliveryAttempt> attempts);
}
