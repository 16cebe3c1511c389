package chorus;

import chorus.digest.DigestScheduler;
import chorus.dispatch.BroadcastEngine;
import chorus.dispatch.BroadcastHook;
import chorus.dispatch.RetryPolicy;
import chorus.model.Attachment;
import chorus.model.Broadcast;
import chorus.reaction.ReactionAggregator;
import chorus.reaction.TargetMessageResolver;
import chorus.reaction.UpdateTimingPolicy;
import chorus.spi.BlobStore;
import chorus.spi.MessageLedger;
import chorus.spi.MetricsExporter;
import chorus.spi.RecipientDirectory;
import chorus.spi.Transport;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Composite entry point that wires a {@link BroadcastEngine}, {@link ReactionAggregator},
 * {@link DigestScheduler} and {@link InboundMessageHandler} into a single
 * {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Chorus chorus = Chorus.builder()
 *     .directory(JdbcRecipientDirectory.of(dataSource))
 *     .ledger(JdbcMessageLedgers.detect(dataSource))
 *     .transport(new LoggingTransport())
 *     .build()) {
 *   Optional<String> reply = chorus.handle("+15550001", "Loved \"see you sunday\"", List.of());
 * }
 * }</pre>
 *
 * <p>The digest scheduler is started by {@link Builder#build()} unless digests are disabled.
 */
public final class Chorus implements AutoCloseable {

  private final BroadcastEngine engine;
  private final ReactionAggregator aggregator;
  private final DigestScheduler digestScheduler;
  private final InboundMessageHandler handler;
  private final MetricsExporter metrics;

  private Chorus(BroadcastEngine engine, ReactionAggregator aggregator,
      DigestScheduler digestScheduler, InboundMessageHandler handler, MetricsExporter metrics) {
    this.engine = engine;
    this.aggregator = aggregator;
    this.digestScheduler = digestScheduler;
    this.handler = handler;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** @see InboundMessageHandler#handle(String, String, List) */
  public Optional<String> handle(String senderAddress, String text, List<Attachment> attachments) {
    return handler.handle(senderAddress, text, attachments);
  }

  public InboundMessageHandler handler() {
    return handler;
  }

  public BroadcastEngine engine() {
    return engine;
  }

  public ReactionAggregator aggregator() {
    return aggregator;
  }

  /** Returns the digest scheduler, or {@code null} when digests are disabled. */
  public DigestScheduler digestScheduler() {
    return digestScheduler;
  }

  /**
   * Shuts down components in order: digest scheduler, engine, then the metrics exporter
   * if it is closeable.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    if (digestScheduler != null) {
      try {
        digestScheduler.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    try {
      engine.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link Chorus}. Unset optional values fall back to each component's default. */
  public static final class Builder {
    private RecipientDirectory directory;
    private MessageLedger ledger;
    private Transport transport;
    private BlobStore blobStore;
    private MetricsExporter metrics;
    private Clock clock;
    private RetryPolicy retryPolicy;
    private Integer maxAttempts;
    private Integer workerCount;
    private Duration recipientTimeout;
    private UpdateTimingPolicy timingPolicy;
    private Duration lookback;
    private boolean digestEnabled = true;
    private Duration pauseDelay;
    private Duration pauseWindow;
    private LocalTime dailyTime;
    private Integer dailyTopN;
    private ZoneId zone;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder directory(RecipientDirectory directory) {
      this.directory = directory;
      return this;
    }

    /** <b>Required.</b> */
    public Builder ledger(MessageLedger ledger) {
      this.ledger = ledger;
      return this;
    }

    /** <b>Required.</b> */
    public Builder transport(Transport transport) {
      this.transport = transport;
      return this;
    }

    public Builder blobStore(BlobStore blobStore) {
      this.blobStore = blobStore;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    public Builder recipientTimeout(Duration recipientTimeout) {
      this.recipientTimeout = recipientTimeout;
      return this;
    }

    public Builder timingPolicy(UpdateTimingPolicy timingPolicy) {
      this.timingPolicy = timingPolicy;
      return this;
    }

    /** Reaction target lookback window. */
    public Builder lookback(Duration lookback) {
      this.lookback = lookback;
      return this;
    }

    /** Disables both digest triggers. Enabled by default. */
    public Builder digestEnabled(boolean digestEnabled) {
      this.digestEnabled = digestEnabled;
      return this;
    }

    public Builder pauseDelay(Duration pauseDelay) {
      this.pauseDelay = pauseDelay;
      return this;
    }

    public Builder pauseWindow(Duration pauseWindow) {
      this.pauseWindow = pauseWindow;
      return this;
    }

    public Builder dailyTime(LocalTime dailyTime) {
      this.dailyTime = dailyTime;
      return this;
    }

    public Builder dailyTopN(int dailyTopN) {
      this.dailyTopN = dailyTopN;
      return this;
    }

    public Builder zone(ZoneId zone) {
      this.zone = zone;
      return this;
    }

    /**
     * Wires the components and starts the digest scheduler.
     *
     * @throws NullPointerException     if {@code directory}, {@code ledger} or
     *                                  {@code transport} is null
     * @throws IllegalArgumentException if a setting is out of range
     */
    public Chorus build() {
      Objects.requireNonNull(directory, "directory");
      Objects.requireNonNull(ledger, "ledger");
      Objects.requireNonNull(transport, "transport");
      MetricsExporter m = metrics != null ? metrics : MetricsExporter.NOOP;
      Clock c = clock != null ? clock : Clock.systemDefaultZone();

      DigestScheduler digest = null;
      BroadcastEngine.Builder engineBuilder = BroadcastEngine.builder()
          .directory(directory)
          .ledger(ledger)
          .transport(transport)
          .retryPolicy(retryPolicy)
          .metrics(m)
          .clock(c);
      if (maxAttempts != null) engineBuilder.maxAttempts(maxAttempts);
      if (workerCount != null) engineBuilder.workerCount(workerCount);
      if (recipientTimeout != null) engineBuilder.recipientTimeout(recipientTimeout);

      DigestScheduler.Builder digestBuilder = null;
      if (digestEnabled) {
        digestBuilder = DigestScheduler.builder()
            .ledger(ledger)
            .metrics(m)
            .clock(c)
            .zone(zone);
        if (pauseDelay != null) digestBuilder.pauseDelay(pauseDelay);
        if (pauseWindow != null) digestBuilder.pauseWindow(pauseWindow);
        if (dailyTime != null) digestBuilder.dailyTime(dailyTime);
        if (dailyTopN != null) digestBuilder.dailyTopN(dailyTopN);
      }

      // The scheduler needs the engine and the engine needs the scheduler as a hook
      DigestHookRelay relay = new DigestHookRelay();
      BroadcastEngine engine = digestBuilder != null
          ? engineBuilder.hook(relay).build() : engineBuilder.build();

      ReactionAggregator aggregator;
      InboundMessageHandler handler;
      try {
        if (digestBuilder != null) {
          digest = digestBuilder.engine(engine).build();
          relay.target = digest;
        }
        aggregator = ReactionAggregator.builder()
            .ledger(ledger)
            .timingPolicy(timingPolicy)
            .metrics(m)
            .clock(c)
            .build();
        handler = InboundMessageHandler.builder()
            .directory(directory)
            .ledger(ledger)
            .engine(engine)
            .aggregator(aggregator)
            .resolver(new TargetMessageResolver(ledger, c))
            .blobStore(blobStore)
            .lookback(lookback)
            .clock(c)
            .build();
        if (digest != null) {
          digest.start();
        }
      } catch (RuntimeException e) {
        engine.close();
        throw e;
      }
      return new Chorus(engine, aggregator, digest, handler, m);
    }
  }

  private static final class DigestHookRelay implements BroadcastHook {
    private volatile DigestScheduler target;

    @Override
    public void afterBroadcast(Broadcast broadcast) {
      DigestScheduler t = target;
      if (t != null) {
        t.afterBroadcast(broadcast);
      }
    }
  }
}
