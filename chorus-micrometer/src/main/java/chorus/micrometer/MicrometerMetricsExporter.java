package chorus.micrometer;

import chorus.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and a gauge with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code chorus.broadcast.sent}: fan-outs completed (broadcasts, digests, updates)</li>
 *   <li>{@code chorus.delivery.success}: recipients delivered</li>
 *   <li>{@code chorus.delivery.failure}: recipients failed after retries or timed out</li>
 *   <li>{@code chorus.delivery.retry}: transport attempts that were retried</li>
 *   <li>{@code chorus.reaction.applied}: reactions applied</li>
 *   <li>{@code chorus.reaction.update.sent}: reaction summaries re-sent</li>
 *   <li>{@code chorus.digest.emitted}: digests sent, tagged {@code kind=pause|daily}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code chorus.fanout.last.ms}: duration of the last fan-out in milliseconds</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter broadcastSent;
  private final Counter deliverySuccess;
  private final Counter deliveryFailure;
  private final Counter deliveryRetry;
  private final Counter reactionApplied;
  private final Counter reactionUpdateSent;
  private final Counter pauseDigests;
  private final Counter dailyDigests;
  private final Gauge fanOutGauge;

  private final AtomicLong lastFanOutMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "chorus"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "chorus");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "youth.chorus"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.broadcastSent = Counter.builder(namePrefix + ".broadcast.sent")
        .description("Fan-outs completed")
        .register(registry);
    this.deliverySuccess = Counter.builder(namePrefix + ".delivery.success")
        .description("Recipients delivered")
        .register(registry);
    this.deliveryFailure = Counter.builder(namePrefix + ".delivery.failure")
        .description("Recipients failed after retries or timed out")
        .register(registry);
    this.deliveryRetry = Counter.builder(namePrefix + ".delivery.retry")
        .description("Transport attempts retried")
        .register(registry);
    this.reactionApplied = Counter.builder(namePrefix + ".reaction.applied")
        .description("Reactions applied")
        .register(registry);
    this.reactionUpdateSent = Counter.builder(namePrefix + ".reaction.update.sent")
        .description("Reaction summaries re-sent to the roster")
        .register(registry);
    this.pauseDigests = Counter.builder(namePrefix + ".digest.emitted")
        .tag("kind", "pause")
        .description("Digests sent")
        .register(registry);
    this.dailyDigests = Counter.builder(namePrefix + ".digest.emitted")
        .tag("kind", "daily")
        .description("Digests sent")
        .register(registry);

    this.fanOutGauge = Gauge.builder(namePrefix + ".fanout.last.ms", lastFanOutMs, AtomicLong::get)
        .register(registry);
  }

  @Override
  public void incrementBroadcastSent() {
    if (closed) return;
    broadcastSent.increment();
  }

  @Override
  public void incrementDeliverySuccess() {
    if (closed) return;
    deliverySuccess.increment();
  }

  @Override
  public void incrementDeliveryFailure() {
    if (closed) return;
    deliveryFailure.increment();
  }

  @Override
  public void incrementDeliveryRetry() {
    if (closed) return;
    deliveryRetry.increment();
  }

  @Override
  public void incrementReactionApplied() {
    if (closed) return;
    reactionApplied.increment();
  }

  @Override
  public void incrementReactionUpdateSent() {
    if (closed) return;
    reactionUpdateSent.increment();
  }

  @Override
  public void incrementDigestEmitted(String kind) {
    if (closed) return;
    if ("daily".equals(kind)) {
      dailyDigests.increment();
    } else {
      pauseDigests.increment();
    }
  }

  @Override
  public void recordFanOutDurationMs(long durationMs) {
    if (closed) return;
    lastFanOutMs.set(durationMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Called by {@link chorus.Chorus#close()} so that no stale gauge outlives the engine.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(broadcastSent, deliverySuccess, deliveryFailure, deliveryRetry,
        reactionApplied, reactionUpdateSent, pauseDigests, dailyDigests, fanOutGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
