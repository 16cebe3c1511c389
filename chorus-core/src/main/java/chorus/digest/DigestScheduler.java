package chorus.digest;

import chorus.NoRecipientsException;
import chorus.dispatch.BroadcastEngine;
import chorus.dispatch.BroadcastHook;
import chorus.dispatch.BroadcastOutcome;
import chorus.model.Broadcast;
import chorus.model.Reaction;
import chorus.reaction.ReactionSummaryFormatter;
import chorus.spi.MessageLedger;
import chorus.spi.MetricsExporter;
import chorus.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Emits reaction digests on two triggers.
 *
 * <ul>
 *   <li><b>Pause</b>: a single-shot timer restarted by every new broadcast. When it fires,
 *       unprocessed active reactions from the pause window are summarized per broadcast.
 *   <li><b>Daily</b>: fires at a fixed local time and summarizes the day's unprocessed
 *       active reactions, listing the most reacted broadcasts.
 * </ul>
 *
 * <p>All timer state lives in a {@link SchedulerState} owned by the single scheduler thread.
 * {@link #afterBroadcast(Broadcast)} does not touch it directly: it submits a reset task to
 * that thread, and the newest reset replaces any pending pause digest. Digest emission is
 * serialized, so a pause digest and a daily digest never mark the same reactions twice.
 *
 * <p>Reactions included in a sent digest are marked processed and never reconsidered.
 * When the roster is empty or the store is unavailable nothing is marked and the next
 * trigger retries.
 *
 * <p>Register the scheduler as a {@link BroadcastHook} on the {@link BroadcastEngine} and
 * call {@link #start()}. {@link #runPauseDigest()} and {@link #runDailyDigest()} may also be
 * invoked directly.
 *
 * @see DigestScheduler.Builder
 */
public final class DigestScheduler implements BroadcastHook, AutoCloseable {
  private static final Logger logger = Logger.getLogger(DigestScheduler.class.getName());

  static final String PAUSE = "pause";
  static final String DAILY = "daily";

  private final BroadcastEngine engine;
  private final MessageLedger ledger;
  private final DigestFormatter formatter;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final ZoneId zone;
  private final Duration pauseDelay;
  private final Duration pauseWindow;
  private final LocalTime dailyTime;
  private final int dailyTopN;

  private final ReentrantLock digestLock = new ReentrantLock();
  private final SchedulerState state = new SchedulerState();

  private volatile ScheduledExecutorService scheduler;
  private volatile boolean closed;

  private DigestScheduler(Builder builder) {
    this.engine = Objects.requireNonNull(builder.engine, "engine");
    this.ledger = Objects.requireNonNull(builder.ledger, "ledger");
    this.formatter = builder.formatter != null ? builder.formatter : new DigestFormatter();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemDefaultZone();
    this.zone = builder.zone != null ? builder.zone : this.clock.getZone();
    this.pauseDelay = Objects.requireNonNull(builder.pauseDelay, "pauseDelay");
    this.pauseWindow = Objects.requireNonNull(builder.pauseWindow, "pauseWindow");
    this.dailyTime = Objects.requireNonNull(builder.dailyTime, "dailyTime");

    if (pauseDelay.isNegative() || pauseDelay.isZero()) {
      throw new IllegalArgumentException("pauseDelay must be positive");
    }
    if (pauseWindow.isNegative() || pauseWindow.isZero()) {
      throw new IllegalArgumentException("pauseWindow must be positive");
    }
    if (builder.dailyTopN < 1) {
      throw new IllegalArgumentException("dailyTopN must be >= 1");
    }
    this.dailyTopN = builder.dailyTopN;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduler thread and schedules the first daily digest. Subsequent calls are
   * no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("DigestScheduler has been closed");
    }
    if (scheduler != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("chorus-digest-"));
    scheduler.execute(this::scheduleNextDaily);
  }

  /**
   * Restarts the silence timer. Called by the engine after every new broadcast; digests
   * and reaction updates do not reach this hook.
   */
  @Override
  public void afterBroadcast(Broadcast broadcast) {
    resetPauseTimer(broadcast.createdAt());
  }

  /**
   * Submits a timer reset to the scheduler thread. Ignored before {@link #start()} and
   * after {@link #close()}.
   *
   * @param broadcastAt when the triggering broadcast was accepted
   */
  public void resetPauseTimer(Instant broadcastAt) {
    ScheduledExecutorService s = scheduler;
    if (s == null || closed) {
      logger.log(Level.FINE, "Digest scheduler not running; pause timer reset ignored");
      return;
    }
    try {
      s.execute(() -> {
        ScheduledFuture<?> next = s.schedule(this::firePause, pauseDelay.toMillis(), TimeUnit.MILLISECONDS);
        state.replacePendingPause(next, broadcastAt);
      });
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Digest scheduler shut down; pause timer reset dropped");
    }
  }

  private void firePause() {
    state.pauseFired();
    runPauseDigest();
  }

  private void fireDaily() {
    try {
      runDailyDigest();
    } finally {
      if (!closed) {
        scheduleNextDaily();
      }
    }
  }

  private void scheduleNextDaily() {
    ScheduledExecutorService s = scheduler;
    if (s == null || closed) {
      return;
    }
    ZonedDateTime now = ZonedDateTime.ofInstant(clock.instant(), zone);
    ZonedDateTime next = nextDailyRun(now, dailyTime);
    state.nextDailyRun(next.toInstant());
    try {
      s.schedule(this::fireDaily, Duration.between(now, next).toMillis(), TimeUnit.MILLISECONDS);
      logger.log(Level.FINE, "Next daily digest at {0}", next);
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Digest scheduler shut down; daily digest not rescheduled");
    }
  }

  /**
   * Returns the first occurrence of {@code at} strictly after {@code now}, in {@code now}'s zone.
   */
  static ZonedDateTime nextDailyRun(ZonedDateTime now, LocalTime at) {
    ZonedDateTime candidate = now.toLocalDate().atTime(at).atZone(now.getZone());
    if (!candidate.isAfter(now)) {
      candidate = now.toLocalDate().plusDays(1).atTime(at).atZone(now.getZone());
    }
    return candidate;
  }

  /**
   * Builds and sends the pause digest.
   *
   * @return number of reactions included and marked processed; {@code 0} when there was
   *     nothing to send or the digest could not be delivered
   */
  public int runPauseDigest() {
    return emit(PAUSE, () -> {
      Instant since = clock.instant().minus(pauseWindow);
      List<Reaction> pending = activeOnly(ledger.unprocessedReactions(since));
      if (pending.isEmpty()) {
        return null;
      }
      List<DigestFormatter.Entry> entries = group(pending);
      if (entries.isEmpty()) {
        return null;
      }
      entries.sort(Comparator.comparing(e -> e.broadcast().createdAt()));
      return new Digest(formatter.formatPause(entries), pending);
    });
  }

  /**
   * Builds and sends the daily digest for the current local day.
   *
   * @return number of reactions included and marked processed; {@code 0} when there was
   *     nothing to send or the digest could not be delivered
   */
  public int runDailyDigest() {
    return emit(DAILY, () -> {
      Instant startOfDay = ZonedDateTime.ofInstant(clock.instant(), zone)
          .toLocalDate().atStartOfDay(zone).toInstant();
      List<Reaction> pending = activeOnly(ledger.unprocessedReactions(startOfDay));
      if (pending.isEmpty()) {
        return null;
      }
      List<DigestFormatter.Entry> entries = group(pending);
      if (entries.isEmpty()) {
        return null;
      }
      entries.sort(Comparator.comparingInt(DigestFormatter.Entry::total).reversed()
          .thenComparing(e -> e.broadcast().createdAt(), Comparator.<Instant>reverseOrder()));
      List<DigestFormatter.Entry> top = entries.subList(0, Math.min(dailyTopN, entries.size()));
      // The whole day is marked, not only the listed broadcasts
      return new Digest(formatter.formatDaily(top, pending.size()), pending);
    });
  }

  private record Digest(String text, List<Reaction> reactions) {
  }

  private int emit(String kind, Callable<Digest> build) {
    digestLock.lock();
    try {
      Digest digest = build.call();
      if (digest == null) {
        logger.log(Level.FINE, "No unprocessed reactions for {0} digest", kind);
        return 0;
      }
      BroadcastOutcome outcome = engine.announce(digest.text(), null);
      ledger.markProcessed(digest.reactions());
      metrics.incrementDigestEmitted(kind);
      logger.log(Level.INFO, "Sent {0} digest covering {1} reactions: sent={2}, failed={3}",
          new Object[]{kind, digest.reactions().size(), outcome.sentCount(), outcome.failedCount()});
      return digest.reactions().size();
    } catch (NoRecipientsException e) {
      logger.log(Level.WARNING, "No recipients for {0} digest; reactions stay unprocessed", kind);
      return 0;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Failed to emit " + kind + " digest", t);
      return 0;
    } finally {
      digestLock.unlock();
    }
  }

  private static List<Reaction> activeOnly(List<Reaction> reactions) {
    List<Reaction> active = new ArrayList<>(reactions.size());
    for (Reaction reaction : reactions) {
      if (reaction.active() && !reaction.processed()) {
        active.add(reaction);
      }
    }
    return active;
  }

  private List<DigestFormatter.Entry> group(List<Reaction> reactions) {
    Map<String, List<Reaction>> byBroadcast = new LinkedHashMap<>();
    for (Reaction reaction : reactions) {
      byBroadcast.computeIfAbsent(reaction.broadcastId(), id -> new ArrayList<>()).add(reaction);
    }
    List<DigestFormatter.Entry> entries = new ArrayList<>(byBroadcast.size());
    for (Map.Entry<String, List<Reaction>> e : byBroadcast.entrySet()) {
      Optional<Broadcast> broadcast = ledger.findBroadcast(e.getKey());
      if (broadcast.isEmpty()) {
        logger.log(Level.WARNING, "Skipping reactions on unknown broadcast {0}", e.getKey());
        continue;
      }
      Map<String, Integer> counts = ReactionSummaryFormatter.countActive(e.getValue());
      entries.add(new DigestFormatter.Entry(broadcast.get(), counts, e.getValue().size()));
    }
    return entries;
  }

  /**
   * Whether a pause digest is currently waiting to fire. Queried on the scheduler thread.
   */
  public boolean hasPendingPause() {
    Boolean pending = query(state::hasPendingPause);
    return pending != null && pending;
  }

  /** Number of silence timer resets applied so far. */
  public long pauseResets() {
    Long resets = query(state::resets);
    return resets != null ? resets : 0L;
  }

  /** When the daily digest will next fire, or {@code null} if not started. */
  public Instant scheduledDailyRun() {
    return query(state::nextDailyRun);
  }

  private <T> T query(Callable<T> read) {
    ScheduledExecutorService s = scheduler;
    if (s == null || closed) {
      return null;
    }
    try {
      return s.submit(read).get(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return null;
    } catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
      logger.log(Level.WARNING, "Scheduler state query failed", e);
      return null;
    }
  }

  /** Cancels both timers and stops the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link DigestScheduler}. */
  public static final class Builder {
    private BroadcastEngine engine;
    private MessageLedger ledger;
    private DigestFormatter formatter;
    private MetricsExporter metrics;
    private Clock clock;
    private ZoneId zone;
    private Duration pauseDelay = Duration.ofMinutes(30);
    private Duration pauseWindow = Duration.ofHours(2);
    private LocalTime dailyTime = LocalTime.of(20, 0);
    private int dailyTopN = 5;

    private Builder() {}

    /**
     * Sets the engine digests are announced through.
     *
     * <p><b>Required.</b>
     *
     * @param engine the broadcast engine
     * @return this builder
     */
    public Builder engine(BroadcastEngine engine) {
      this.engine = engine;
      return this;
    }

    /**
     * Sets the ledger unprocessed reactions are read from and marked in.
     *
     * <p><b>Required.</b>
     *
     * @param ledger the message ledger
     * @return this builder
     */
    public Builder ledger(MessageLedger ledger) {
      this.ledger = ledger;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link DigestFormatter}.
     *
     * @param formatter the digest formatter
     * @return this builder
     */
    public Builder formatter(DigestFormatter formatter) {
      this.formatter = formatter;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link Clock#systemDefaultZone()}.
     *
     * @param clock clock for digest windows and the daily schedule
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the zone the daily time and "today" are evaluated in.
     *
     * <p>Optional. Defaults to the clock's zone.
     *
     * @param zone the zone
     * @return this builder
     */
    public Builder zone(ZoneId zone) {
      this.zone = zone;
      return this;
    }

    /**
     * Sets the silence interval after the last broadcast before a pause digest is sent.
     *
     * <p>Optional. Defaults to 30 minutes. Must be positive.
     *
     * @param pauseDelay silence interval
     * @return this builder
     */
    public Builder pauseDelay(Duration pauseDelay) {
      this.pauseDelay = pauseDelay;
      return this;
    }

    /**
     * Sets how far back a pause digest looks for reactions.
     *
     * <p>Optional. Defaults to 2 hours. Must be positive.
     *
     * @param pauseWindow look-back window
     * @return this builder
     */
    public Builder pauseWindow(Duration pauseWindow) {
      this.pauseWindow = pauseWindow;
      return this;
    }

    /**
     * <p>Optional. Defaults to 20:00.
     *
     * @param dailyTime local time of the daily digest
     * @return this builder
     */
    public Builder dailyTime(LocalTime dailyTime) {
      this.dailyTime = dailyTime;
      return this;
    }

    /**
     * Sets how many broadcasts the daily digest lists.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 1.
     *
     * @param dailyTopN number of broadcasts listed
     * @return this builder
     */
    public Builder dailyTopN(int dailyTopN) {
      this.dailyTopN = dailyTopN;
      return this;
    }

    public DigestScheduler build() {
      return new DigestScheduler(this);
    }
  }
}
