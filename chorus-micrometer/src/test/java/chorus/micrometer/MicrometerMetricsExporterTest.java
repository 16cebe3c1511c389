package chorus.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void deliveryCounters() {
    exporter.incrementDeliverySuccess();
    exporter.incrementDeliverySuccess();
    exporter.incrementDeliveryFailure();
    exporter.incrementDeliveryRetry();
    exporter.incrementBroadcastSent();

    assertEquals(2.0, counter("chorus.delivery.success").count());
    assertEquals(1.0, counter("chorus.delivery.failure").count());
    assertEquals(1.0, counter("chorus.delivery.retry").count());
    assertEquals(1.0, counter("chorus.broadcast.sent").count());
  }

  @Test
  void reactionCounters() {
    exporter.incrementReactionApplied();
    exporter.incrementReactionApplied();
    exporter.incrementReactionApplied();
    exporter.incrementReactionUpdateSent();

    assertEquals(3.0, counter("chorus.reaction.applied").count());
    assertEquals(1.0, counter("chorus.reaction.update.sent").count());
  }

  @Test
  void digestCounterIsTaggedByKind() {
    exporter.incrementDigestEmitted("pause");
    exporter.incrementDigestEmitted("daily");
    exporter.incrementDigestEmitted("daily");

    assertEquals(1.0, registry.find("chorus.digest.emitted").tag("kind", "pause").counter().count());
    assertEquals(2.0, registry.find("chorus.digest.emitted").tag("kind", "daily").counter().count());
  }

  @Test
  void recordFanOutDuration() {
    exporter.recordFanOutDurationMs(1234L);
    assertEquals(1234.0, gauge("chorus.fanout.last.ms").value());

    exporter.recordFanOutDurationMs(0L);
    assertEquals(0.0, gauge("chorus.fanout.last.ms").value());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "youth.chorus");
    custom.incrementBroadcastSent();
    custom.recordFanOutDurationMs(500L);

    assertEquals(1.0, counter("youth.chorus.broadcast.sent").count());
    assertEquals(500.0, gauge("youth.chorus.fanout.last.ms").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementBroadcastSent();
    exporter.close();

    assertNull(registry.find("chorus.broadcast.sent").counter());
    assertNull(registry.find("chorus.fanout.last.ms").gauge());
    exporter.incrementBroadcastSent();
    exporter.recordFanOutDurationMs(10L);
  }

  @Test
  void invalidPrefixRejected() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "chorus."));
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
