package chorus.reaction;

import chorus.model.Broadcast;
import chorus.model.Reaction;
import chorus.model.ReactionAction;
import chorus.model.ReactionKey;
import chorus.spi.MessageLedger;
import chorus.spi.MetricsExporter;
import chorus.util.KeyedLocks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies reactions to the ledger and keeps each broadcast's summary in step.
 *
 * <p>Transition for {@code (broadcast, reactor, emoji)}:
 * <table>
 *   <caption>Reaction transitions</caption>
 *   <tr><th>existing row</th><th>emoji</th><th>result</th></tr>
 *   <tr><td>none</td><td>-</td><td>insert active ({@code ADDED})</td></tr>
 *   <tr><td>active</td><td>same</td><td>deactivate ({@code REMOVED})</td></tr>
 *   <tr><td>inactive</td><td>same</td><td>reactivate ({@code ADDED})</td></tr>
 *   <tr><td>any</td><td>different</td><td>replace, keep previous, activate ({@code CHANGED})</td></tr>
 * </table>
 *
 * <p>The row mutation runs under a lock for its {@code (broadcast, reactor)} key, so
 * near-simultaneous double reactions cannot lose an update, while different reactors on
 * the same broadcast proceed in parallel. The summary is then recomputed from the active
 * rows and written back under a per-broadcast lock, inside the same call.
 *
 * <p>This class never sends anything. The {@link AggregationResult#sendUpdate()} flag
 * tells the caller whether to dispatch the new summary; after doing so the caller reports
 * it through {@link #markUpdateSent(String)}.
 */
public final class ReactionAggregator {
  private static final Logger logger = Logger.getLogger(ReactionAggregator.class.getName());

  private final MessageLedger ledger;
  private final UpdateTimingPolicy timingPolicy;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final KeyedLocks<ReactionKey> rowLocks = new KeyedLocks<>();
  private final KeyedLocks<String> summaryLocks = new KeyedLocks<>();

  private ReactionAggregator(Builder builder) {
    this.ledger = Objects.requireNonNull(builder.ledger, "ledger");
    this.timingPolicy = builder.timingPolicy != null ? builder.timingPolicy : new DefaultUpdateTimingPolicy();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Applies a reaction from {@code reactorAddress} to {@code target}.
   *
   * @param target         the resolved broadcast
   * @param reactorAddress who reacted
   * @param reactorName    display name stored on the row
   * @param emoji          the emoji to apply
   * @return the transition taken, the recomputed summary and the update decision
   */
  public AggregationResult apply(Broadcast target, String reactorAddress, String reactorName, String emoji) {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(reactorAddress, "reactorAddress");
    Objects.requireNonNull(reactorName, "reactorName");
    Objects.requireNonNull(emoji, "emoji");

    ReactionKey key = new ReactionKey(target.id(), reactorAddress);
    Transition transition = rowLocks.withLock(key, () -> applyTransition(key, reactorName, emoji));
    List<Reaction> active = summaryLocks.withLock(target.id(), () -> recomputeSummary(target.id()));
    metrics.incrementReactionApplied();

    String summary = ReactionSummaryFormatter.format(active);
    Broadcast current = ledger.findBroadcast(target.id()).orElse(target).withReactionSummary(summary);
    boolean sendUpdate = timingPolicy.shouldSendUpdate(timingContext(current, transition.action(), active));

    logger.log(Level.FINE, "Reaction {0} by {1} on {2}: {3} (total={4}, sendUpdate={5})",
        new Object[]{emoji, reactorAddress, target.id(), transition.action().label(), active.size(), sendUpdate});
    return new AggregationResult(current, transition.reaction(), transition.action(), active.size(), sendUpdate);
  }

  /**
   * Records that the summary of {@code broadcastId} has just been sent to the roster.
   */
  public void markUpdateSent(String broadcastId) {
    ledger.markSummaryBroadcast(broadcastId, clock.instant());
    metrics.incrementReactionUpdateSent();
  }

  private Transition applyTransition(ReactionKey key, String reactorName, String emoji) {
    Instant now = clock.instant();
    Optional<Reaction> existing = ledger.getReaction(key.broadcastId(), key.reactorAddress());
    Reaction updated;
    ReactionAction action;
    if (existing.isEmpty()) {
      updated = Reaction.first(key.broadcastId(), key.reactorAddress(), reactorName, emoji, now);
      action = ReactionAction.ADDED;
    } else if (existing.get().emoji().equals(emoji)) {
      boolean nowActive = !existing.get().active();
      updated = existing.get().withActive(nowActive, now);
      action = nowActive ? ReactionAction.ADDED : ReactionAction.REMOVED;
    } else {
      updated = existing.get().withEmoji(emoji, now);
      action = ReactionAction.CHANGED;
    }
    ledger.upsertReaction(updated);
    return new Transition(updated, action);
  }

  private List<Reaction> recomputeSummary(String broadcastId) {
    List<Reaction> active = ledger.activeReactions(broadcastId);
    ledger.updateSummary(broadcastId, ReactionSummaryFormatter.format(active));
    return active;
  }

  private UpdateTimingPolicy.Context timingContext(Broadcast broadcast, ReactionAction action,
      List<Reaction> active) {
    Instant reference = broadcast.lastReactionUpdate() != null
        ? broadcast.lastReactionUpdate() : broadcast.createdAt();
    Duration since = Duration.between(reference, clock.instant());
    int landed = 0;
    for (Reaction reaction : active) {
      if (reaction.updatedAt().isAfter(reference)) {
        landed++;
      }
    }
    return new UpdateTimingPolicy.Context(active.size(), action,
        since.isNegative() ? Duration.ZERO : since, landed);
  }

  private record Transition(Reaction reaction, ReactionAction action) {}

  /** Builder for {@link ReactionAggregator}. */
  public static final class Builder {
    private MessageLedger ledger;
    private UpdateTimingPolicy timingPolicy;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     */
    public Builder ledger(MessageLedger ledger) {
      this.ledger = ledger;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link DefaultUpdateTimingPolicy}.
     */
    public Builder timingPolicy(UpdateTimingPolicy timingPolicy) {
      this.timingPolicy = timingPolicy;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public ReactionAggregator build() {
      return new ReactionAggregator(this);
    }
  }
}
