package chorus.digest;

import chorus.dispatch.BroadcastEngine;
import chorus.model.Broadcast;
import chorus.model.Reaction;
import chorus.model.ReactionKey;
import chorus.spi.SendResult;
import chorus.spi.Transport;
import chorus.testing.InMemoryMessageLedger;
import chorus.testing.InMemoryRecipientDirectory;
import chorus.testing.MutableClock;
import chorus.testing.RecordingMetrics;
import chorus.testing.RecordingTransport;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class DigestSchedulerTest {
  private static final Instant NOW = Instant.parse("2024-05-04T18:00:00Z");

  private InMemoryMessageLedger ledger;
  private InMemoryRecipientDirectory directory;
  private RecordingTransport transport;
  private RecordingMetrics metrics;
  private MutableClock clock;
  private BroadcastEngine engine;
  private DigestScheduler digest;

  @BeforeEach
  void setUp() {
    ledger = new InMemoryMessageLedger();
    directory = new InMemoryRecipientDirectory()
        .add("+1000", "Alice", true)
        .add("+1001", "Bob", false)
        .add("+1002", "Cy", false);
    transport = new RecordingTransport();
    metrics = new RecordingMetrics();
    clock = new MutableClock(NOW);
    engine = BroadcastEngine.builder()
        .directory(directory)
        .ledger(ledger)
        .transport(transport)
        .retryPolicy(attempts -> 0L)
        .build();
  }

  @AfterEach
  void tearDown() {
    if (digest != null) {
      digest.close();
    }
    engine.close();
  }

  private DigestScheduler.Builder builder() {
    return DigestScheduler.builder()
        .engine(engine)
        .ledger(ledger)
        .metrics(metrics)
        .clock(clock);
  }

  private Broadcast broadcast(String id, String name, String text, Duration ago) {
    return ledger.seed(id, "+" + name, name, text, NOW.minus(ago));
  }

  private void react(String broadcastId, String reactor, String emoji, Duration ago, boolean active) {
    Instant at = NOW.minus(ago);
    ledger.upsertReaction(new Reaction(broadcastId, reactor, reactor, emoji, null, active, false, at, at));
  }

  private long processedCount() {
    return ledger.allReactions().stream().filter(Reaction::processed).count();
  }

  @Test
  void pauseDigestSummarizesAndMarksProcessed() {
    digest = builder().build();
    broadcast("b1", "Alice", "Game at noon", Duration.ofMinutes(90));
    broadcast("b2", "Bob", "Pizza after", Duration.ofMinutes(40));
    react("b2", "+2001", "❤️", Duration.ofMinutes(30), true);
    react("b2", "+2002", "❤️", Duration.ofMinutes(25), true);
    react("b1", "+2003", "👍", Duration.ofMinutes(20), true);

    assertEquals(3, digest.runPauseDigest());

    String expected = "🔔 While things were quiet:\n"
        + "\nAlice: \"Game at noon\" 👍"
        + "\nBob: \"Pizza after\" ❤️×2";
    assertEquals(List.of(expected), transport.textsTo("+1000"));
    assertEquals(1, transport.textsTo("+1001").size());
    assertEquals(3, processedCount());
    assertEquals(1, metrics.count("digest.pause"));

    assertEquals(0, digest.runPauseDigest(), "nothing left to report");
    assertEquals(1, transport.textsTo("+1000").size());
  }

  @Test
  void inactiveAndOldReactionsAreLeftOut() {
    digest = builder().build();
    broadcast("b1", "Alice", "Game at noon", Duration.ofHours(5));
    react("b1", "+2001", "❤️", Duration.ofMinutes(10), false);
    react("b1", "+2002", "👍", Duration.ofHours(3), true);

    assertEquals(0, digest.runPauseDigest());
    assertTrue(transport.sent.isEmpty());
    assertEquals(0, processedCount());
  }

  @Test
  void failedDigestLeavesReactionsForNextTrigger() {
    digest = builder().build();
    broadcast("b1", "Alice", "Game at noon", Duration.ofMinutes(30));
    react("b1", "+2001", "❤️", Duration.ofMinutes(10), true);

    directory.remove("+1000");
    directory.remove("+1001");
    directory.remove("+1002");
    assertEquals(0, digest.runPauseDigest());
    assertEquals(0, processedCount());

    directory.add("+1001", "Bob", false);
    ledger.unavailable = true;
    assertEquals(0, digest.runPauseDigest());
    ledger.unavailable = false;
    assertEquals(0, processedCount());

    assertEquals(1, digest.runPauseDigest());
    assertEquals(1, processedCount());
  }

  @Test
  void dailyDigestRanksTopBroadcastsAndMarksWholeDay() {
    digest = builder().dailyTopN(2).build();
    broadcast("bA", "Alice", "Game at noon", Duration.ofHours(9));
    broadcast("bB", "Bob", "Pizza after", Duration.ofHours(8));
    broadcast("bC", "Cy", "Bus leaves 8am", Duration.ofHours(7));
    react("bA", "+2001", "👍", Duration.ofHours(6), true);
    react("bB", "+2001", "❤️", Duration.ofHours(6), true);
    react("bB", "+2002", "❤️", Duration.ofHours(5), true);
    react("bB", "+2003", "😂", Duration.ofHours(5), true);
    react("bC", "+2002", "👍", Duration.ofHours(4), true);
    react("bC", "+2003", "👍", Duration.ofHours(4), true);

    assertEquals(6, digest.runDailyDigest());

    String expected = "🌙 Today's reactions (6 reactions):\n"
        + "\n1. Bob: \"Pizza after\" ❤️×2 😂"
        + "\n2. Cy: \"Bus leaves 8am\" 👍×2";
    assertEquals(List.of(expected), transport.textsTo("+1002"));
    assertEquals(6, processedCount());
    assertEquals(1, metrics.count("digest.daily"));
  }

  @Test
  void overlappingDigestsReportEachReactionOnce() throws Exception {
    List<ReactionKey> marked = new CopyOnWriteArrayList<>();
    ledger = new InMemoryMessageLedger() {
      @Override
      public synchronized int markProcessed(Collection<Reaction> toMark) {
        int changed = super.markProcessed(toMark);
        toMark.forEach(r -> marked.add(r.key()));
        return changed;
      }
    };
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    AtomicInteger sends = new AtomicInteger();
    Transport blocking = (address, text) -> {
      entered.countDown();
      try {
        release.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      sends.incrementAndGet();
      return SendResult.success("sid-" + address);
    };
    engine.close();
    engine = BroadcastEngine.builder()
        .directory(directory)
        .ledger(ledger)
        .transport(blocking)
        .retryPolicy(attempts -> 0L)
        .build();
    digest = builder().build();
    broadcast("b1", "Alice", "Game at noon", Duration.ofMinutes(50));
    react("b1", "+2001", "❤️", Duration.ofMinutes(30), true);
    react("b1", "+2002", "👍", Duration.ofMinutes(20), true);

    AtomicInteger pauseCount = new AtomicInteger(-1);
    AtomicInteger dailyCount = new AtomicInteger(-1);
    Thread pause = new Thread(() -> pauseCount.set(digest.runPauseDigest()), "pause-digest");
    pause.start();
    assertTrue(entered.await(5, TimeUnit.SECONDS), "pause digest reached the transport");

    Thread daily = new Thread(() -> dailyCount.set(digest.runDailyDigest()), "daily-digest");
    daily.start();
    waitFor(() -> daily.getState() == Thread.State.WAITING);
    release.countDown();
    pause.join(5000);
    daily.join(5000);

    assertEquals(2, pauseCount.get());
    assertEquals(0, dailyCount.get());
    assertEquals(2, processedCount());
    assertEquals(2, marked.size());
    assertEquals(2, marked.stream().distinct().count());
    assertEquals(3, sends.get(), "one digest per roster member");
  }

  @Test
  void dailyDigestIgnoresEarlierDays() {
    digest = builder().build();
    broadcast("b1", "Alice", "Game at noon", Duration.ofHours(30));
    react("b1", "+2001", "👍", Duration.ofHours(20), true);

    assertEquals(0, digest.runDailyDigest());
    assertTrue(transport.sent.isEmpty());
  }

  @Test
  void nextDailyRunIsStrictlyAfterNow() {
    ZoneId zone = ZoneId.of("America/Chicago");
    LocalTime eight = LocalTime.of(20, 0);
    ZonedDateTime before = ZonedDateTime.of(2024, 5, 4, 18, 0, 0, 0, zone);
    ZonedDateTime exactly = ZonedDateTime.of(2024, 5, 4, 20, 0, 0, 0, zone);
    ZonedDateTime after = ZonedDateTime.of(2024, 5, 4, 21, 30, 0, 0, zone);

    assertEquals(ZonedDateTime.of(2024, 5, 4, 20, 0, 0, 0, zone), DigestScheduler.nextDailyRun(before, eight));
    assertEquals(ZonedDateTime.of(2024, 5, 5, 20, 0, 0, 0, zone), DigestScheduler.nextDailyRun(exactly, eight));
    assertEquals(ZonedDateTime.of(2024, 5, 5, 20, 0, 0, 0, zone), DigestScheduler.nextDailyRun(after, eight));
  }

  @Test
  void startSchedulesDailyRun() {
    digest = builder().dailyTime(LocalTime.of(20, 0)).build();
    assertNull(digest.scheduledDailyRun());

    digest.start();

    assertEquals(Instant.parse("2024-05-04T20:00:00Z"), digest.scheduledDailyRun());
  }

  @Test
  void pauseTimerFiresAfterSilence() throws Exception {
    digest = builder().pauseDelay(Duration.ofMillis(100)).build();
    digest.start();
    Broadcast b = broadcast("b1", "Alice", "Game at noon", Duration.ofMinutes(30));
    react("b1", "+2001", "❤️", Duration.ofMinutes(10), true);

    digest.afterBroadcast(b);

    waitFor(() -> processedCount() == 1);
    assertEquals(1, transport.textsTo("+1000").size());
    assertFalse(digest.hasPendingPause());
  }

  @Test
  void newBroadcastRestartsSilenceTimer() throws Exception {
    digest = builder().pauseDelay(Duration.ofMillis(1000)).build();
    digest.start();
    broadcast("b1", "Alice", "Game at noon", Duration.ofMinutes(30));
    react("b1", "+2001", "❤️", Duration.ofMinutes(10), true);

    digest.resetPauseTimer(NOW);
    Thread.sleep(600);
    digest.resetPauseTimer(NOW);
    assertEquals(2, digest.pauseResets());
    assertTrue(digest.hasPendingPause());

    // past the first deadline, before the second
    Thread.sleep(700);
    assertTrue(transport.sent.isEmpty(), "replaced timer must not fire");

    waitFor(() -> processedCount() == 1);
    assertEquals(1, transport.textsTo("+1000").size());
  }

  @Test
  void resetIgnoredWhenNotRunning() {
    digest = builder().build();
    digest.resetPauseTimer(NOW);
    assertFalse(digest.hasPendingPause());
    assertEquals(0, digest.pauseResets());

    digest.start();
    digest.close();
    digest.resetPauseTimer(NOW);
    assertFalse(digest.hasPendingPause());
    assertThrows(IllegalStateException.class, () -> digest.start());
  }

  @Test
  void builderValidation() {
    assertThrows(NullPointerException.class, () -> DigestScheduler.builder().ledger(ledger).build());
    assertThrows(IllegalArgumentException.class, () -> builder().pauseDelay(Duration.ZERO).build());
    assertThrows(IllegalArgumentException.class, () -> builder().pauseWindow(Duration.ofMinutes(-1)).build());
    assertThrows(IllegalArgumentException.class, () -> builder().dailyTopN(0).build());
  }

  private static void waitFor(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        fail("condition not met within 5s");
      }
      Thread.sleep(20);
    }
  }
}
