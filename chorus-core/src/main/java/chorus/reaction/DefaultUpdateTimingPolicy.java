package chorus.reaction;

import chorus.model.ReactionAction;

import java.time.Duration;
import java.util.Objects;

/**
 * Sends an update for the first reaction, for every removal, for every {@code n}-th
 * active reaction, and for any reaction after a quiet interval.
 *
 * <p>Defaults: {@code n = 3}, quiet interval 5 minutes.
 */
public final class DefaultUpdateTimingPolicy implements UpdateTimingPolicy {
  public static final int DEFAULT_EVERY_N = 3;
  public static final Duration DEFAULT_QUIET_INTERVAL = Duration.ofMinutes(5);

  private final int everyN;
  private final Duration quietInterval;

  public DefaultUpdateTimingPolicy() {
    this(DEFAULT_EVERY_N, DEFAULT_QUIET_INTERVAL);
  }

  /**
   * @param everyN        send on every multiple of this active total
   * @param quietInterval send when more than this has passed since the last update
   */
  public DefaultUpdateTimingPolicy(int everyN, Duration quietInterval) {
    if (everyN < 1) {
      throw new IllegalArgumentException("everyN must be >= 1, got: " + everyN);
    }
    Objects.requireNonNull(quietInterval, "quietInterval");
    if (quietInterval.isNegative()) {
      throw new IllegalArgumentException("quietInterval must be >= 0");
    }
    this.everyN = everyN;
    this.quietInterval = quietInterval;
  }

  @Override
  public boolean shouldSendUpdate(Context context) {
    if (context.totalActive() == 1) {
      return true;
    }
    if (context.action() == ReactionAction.REMOVED) {
      return true;
    }
    if (context.totalActive() > 0 && context.totalActive() % everyN == 0) {
      return true;
    }
    return context.sinceLastUpdate().compareTo(quietInterval) > 0
        && context.reactionsSinceLastUpdate() > 0;
  }
}
