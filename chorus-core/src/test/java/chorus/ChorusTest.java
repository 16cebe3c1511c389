package chorus;

import chorus.testing.InMemoryMessageLedger;
import chorus.testing.InMemoryRecipientDirectory;
import chorus.testing.RecordingMetrics;
import chorus.testing.RecordingTransport;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ChorusTest {

  private final InMemoryMessageLedger ledger = new InMemoryMessageLedger();
  private final InMemoryRecipientDirectory directory = new InMemoryRecipientDirectory()
      .add("+1000", "Alice", true)
      .add("+1001", "Bob", false);
  private final RecordingTransport transport = new RecordingTransport();

  private Chorus.Builder builder() {
    return Chorus.builder()
        .directory(directory)
        .ledger(ledger)
        .transport(transport)
        .retryPolicy(attempts -> 0L);
  }

  @Test
  void wiresHandlerToEngine() {
    try (Chorus chorus = builder().digestEnabled(false).build()) {
      assertNull(chorus.digestScheduler());
      assertEquals(Optional.of("✅ Message broadcast to 1 member"),
          chorus.handle("+1000", "Hello all", List.of()));
      assertEquals(1, transport.textsTo("+1001").size());
      assertSame(chorus.handler(), chorus.handler());
      assertNotNull(chorus.aggregator());
    }
  }

  @Test
  void broadcastsResetTheSilenceTimer() {
    try (Chorus chorus = builder().pauseDelay(Duration.ofHours(1)).build()) {
      assertNotNull(chorus.digestScheduler());

      chorus.handle("+1001", "Running late", List.of());
      chorus.handle("+1000", "👍", List.of());

      // the reaction update is an announcement and does not count
      assertEquals(1, chorus.digestScheduler().pauseResets());
      assertTrue(chorus.digestScheduler().hasPendingPause());
    }
  }

  @Test
  void closeShutsDownEverythingAndClosesMetrics() {
    AtomicBoolean metricsClosed = new AtomicBoolean();
    Chorus chorus = builder().metrics(new ClosableMetrics(metricsClosed)).build();

    chorus.close();

    assertTrue(metricsClosed.get());
    assertThrows(IllegalStateException.class, () -> chorus.engine().announce("x", null));
    assertFalse(chorus.digestScheduler().hasPendingPause());
  }

  @Test
  void requiredComponents() {
    assertThrows(NullPointerException.class,
        () -> Chorus.builder().ledger(ledger).transport(transport).build());
    assertThrows(NullPointerException.class,
        () -> Chorus.builder().directory(directory).transport(transport).build());
    assertThrows(NullPointerException.class,
        () -> Chorus.builder().directory(directory).ledger(ledger).build());
  }

  @Test
  void invalidSettingFailsBuild() {
    assertThrows(IllegalArgumentException.class, () -> builder().dailyTopN(0).build());
    assertThrows(IllegalArgumentException.class, () -> builder().workerCount(0).build());
  }

  private static final class ClosableMetrics extends RecordingMetrics implements AutoCloseable {
    private final AtomicBoolean closed;

    ClosableMetrics(AtomicBoolean closed) {
      this.closed = closed;
    }

    @Override
    public void close() {
      closed.set(true);
    }
  }
}
