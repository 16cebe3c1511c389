package chorus.spi;

/**
 * Observability hook for exporting broadcast, delivery, reaction and digest counters.
 *
 * <p>The {@link #NOOP} instance discards everything.
 */
public interface MetricsExporter {

  MetricsExporter NOOP = new Noop();

  /** A broadcast, digest or update finished fan-out. */
  void incrementBroadcastSent();

  void incrementDeliverySuccess();

  void incrementDeliveryFailure();

  /** A transport attempt failed and will be retried. */
  void incrementDeliveryRetry();

  void incrementReactionApplied();

  /** An aggregated reaction summary was re-sent to the roster. */
  void incrementReactionUpdateSent();

  /**
   * @param kind {@code "pause"} or {@code "daily"}
   */
  void incrementDigestEmitted(String kind);

  /**
   * Records how long the last fan-out took from first dispatch to settlement.
   */
  default void recordFanOutDurationMs(long durationMs) {
  }

  final class Noop implements MetricsExporter {
    @Override
    public void incrementBroadcastSent() {
    }

    @Override
    public void incrementDeliverySuccess() {
    }

    @Override
    public void incrementDeliveryFailure() {
    }

    @Override
    public void incrementDeliveryRetry() {
    }

    @Override
    public void incrementReactionApplied() {
    }

    @Override
    public void incrementReactionUpdateSent() {
    }

    @Override
    public void incrementDigestEmitted(String kind) {
    }
  }
}
