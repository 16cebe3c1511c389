package chorus.dispatch;

import chorus.NoRecipientsException;
import chorus.UnregisteredSenderException;
import chorus.model.Broadcast;
import chorus.model.DeliveryAttempt;
import chorus.model.DeliveryStatus;
import chorus.model.Recipient;
import chorus.model.SenderIdentity;
import chorus.spi.MessageLedger;
import chorus.spi.MetricsExporter;
import chorus.spi.RecipientDirectory;
import chorus.spi.StoreUnavailableException;
import chorus.spi.Transport;
import chorus.util.DaemonThreadFactory;
import chorus.util.MessageIds;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans an outbound message out to every active recipient.
 *
 * <p>Sends run on a fixed-size worker pool whose size does not depend on the roster, so a
 * large roster queues work instead of opening more concurrent transport calls. Each
 * recipient gets up to {@code maxAttempts} transport calls separated by the
 * {@link RetryPolicy} delay. A recipient that has not settled within
 * {@code recipientTimeout} of starting is cancelled and recorded as failed; it never
 * holds up the others. A single failing recipient never aborts the batch: only an
 * unregistered sender, an empty roster and an unavailable store do.
 *
 * <p>Every recipient ends with one {@link DeliveryAttempt} saved to the ledger.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} to stop its workers.
 *
 * @see BroadcastEngine.Builder
 * @see BroadcastHook
 */
public final class BroadcastEngine implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(BroadcastEngine.class.getName());

  private static final long QUEUED_POLL_MS = 50;

  private final RecipientDirectory directory;
  private final MessageLedger ledger;
  private final Transport transport;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;
  private final int workerCount;
  private final Duration recipientTimeout;
  private final MetricsExporter metrics;
  private final MessageFormatter formatter;
  private final List<BroadcastHook> hooks;
  private final Clock clock;
  private final long drainTimeoutMs;
  private final ExecutorService workers;
  private final AtomicBoolean closed = new AtomicBoolean();

  private BroadcastEngine(Builder builder) {
    this.directory = Objects.requireNonNull(builder.directory, "directory");
    this.ledger = Objects.requireNonNull(builder.ledger, "ledger");
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new LinearBackoffRetryPolicy();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.formatter = builder.formatter != null ? builder.formatter : new MessageFormatter();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.hooks = Collections.unmodifiableList(new ArrayList<>(builder.hooks));

    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (builder.workerCount < 1) {
      throw new IllegalArgumentException("workerCount must be >= 1");
    }
    Objects.requireNonNull(builder.recipientTimeout, "recipientTimeout");
    if (builder.recipientTimeout.isNegative() || builder.recipientTimeout.isZero()) {
      throw new IllegalArgumentException("recipientTimeout must be positive");
    }
    this.maxAttempts = builder.maxAttempts;
    this.workerCount = builder.workerCount;
    this.recipientTimeout = builder.recipientTimeout;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.workers = Executors.newFixedThreadPool(workerCount, new DaemonThreadFactory("chorus-fanout-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Persists a new broadcast from {@code senderAddress} and delivers it to everyone else.
   *
   * @param senderAddress   author address
   * @param text            message body
   * @param attachmentLinks public links to include, possibly empty
   * @return the settled outcome
   * @throws UnregisteredSenderException if the directory does not know the sender
   * @throws NoRecipientsException      if there is nobody else on the roster
   * @throws StoreUnavailableException  if the directory or ledger cannot be reached
   */
  public BroadcastOutcome broadcast(String senderAddress, String text, List<String> attachmentLinks) {
    Objects.requireNonNull(senderAddress, "senderAddress");
    Objects.requireNonNull(text, "text");
    List<String> links = attachmentLinks == null ? List.of() : List.copyOf(attachmentLinks);
    ensureOpen();

    SenderIdentity sender = directory.identity(senderAddress)
        .orElseThrow(() -> new UnregisteredSenderException(senderAddress));
    List<Recipient> recipients = directory.activeRecipients(senderAddress);
    if (recipients.isEmpty()) {
      throw new NoRecipientsException("No members to send to besides " + senderAddress);
    }

    Broadcast broadcast = Broadcast.create(MessageIds.next(), senderAddress, sender.name(), text, clock.instant());
    ledger.saveBroadcast(broadcast);
    BroadcastOutcome outcome = fanOut(broadcast.id(), formatter.formatBroadcast(broadcast, links), recipients);
    logger.log(Level.INFO, "Broadcast {0} from {1}: sent={2}, failed={3}, elapsed={4} ms",
        new Object[]{broadcast.id(), sender.name(), outcome.sentCount(), outcome.failedCount(),
            outcome.elapsed().toMillis()});

    for (BroadcastHook hook : hooks) {
      try {
        hook.afterBroadcast(broadcast);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Broadcast hook failed for " + broadcast.id(), e);
      }
    }
    return outcome;
  }

  /**
   * Delivers a system message (digest, reaction update) that is not stored as a broadcast.
   *
   * @param text           fully formatted text
   * @param excludeAddress address to leave out, or {@code null}
   * @return the settled outcome; {@code messageId} is a fresh synthetic id
   * @throws NoRecipientsException     if nobody would receive it
   * @throws StoreUnavailableException if the directory or ledger cannot be reached
   */
  public BroadcastOutcome announce(String text, String excludeAddress) {
    Objects.requireNonNull(text, "text");
    ensureOpen();
    List<Recipient> recipients = directory.activeRecipients(excludeAddress);
    if (recipients.isEmpty()) {
      throw new NoRecipientsException("No members to send announcement to");
    }
    BroadcastOutcome outcome = fanOut(MessageIds.next(), text, recipients);
    logger.log(Level.INFO, "Announcement {0}: sent={1}, failed={2}",
        new Object[]{outcome.messageId(), outcome.sentCount(), outcome.failedCount()});
    return outcome;
  }

  public MessageFormatter formatter() {
    return formatter;
  }

  private BroadcastOutcome fanOut(String messageId, String text, List<Recipient> recipients) {
    long startNanos = System.nanoTime();
    List<DeliveryTask> tasks = new ArrayList<>(recipients.size());
    List<Future<DeliveryAttempt>> futures = new ArrayList<>(recipients.size());
    for (Recipient recipient : recipients) {
      DeliveryTask task = new DeliveryTask(messageId, recipient.address(), text,
          transport, retryPolicy, maxAttempts, metrics);
      tasks.add(task);
      futures.add(workers.submit(task));
    }

    // A task still queued after every earlier wave would have timed out is given up on
    int waves = (recipients.size() + workerCount - 1) / workerCount;
    long batchDeadline = startNanos + recipientTimeout.toNanos() * (waves + 1L);

    List<DeliveryAttempt> attempts = new ArrayList<>(recipients.size());
    for (int i = 0; i < tasks.size(); i++) {
      attempts.add(await(tasks.get(i), futures.get(i), batchDeadline));
    }

    int sent = 0;
    int failed = 0;
    for (DeliveryAttempt attempt : attempts) {
      if (attempt.status() == DeliveryStatus.DELIVERED) {
        sent++;
        metrics.incrementDeliverySuccess();
      } else {
        failed++;
        metrics.incrementDeliveryFailure();
      }
    }
    Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
    metrics.incrementBroadcastSent();
    metrics.recordFanOutDurationMs(elapsed.toMillis());
    persistAttempts(messageId, attempts);
    return new BroadcastOutcome(messageId, sent, failed, elapsed, attempts);
  }

  private DeliveryAttempt await(DeliveryTask task, Future<DeliveryAttempt> future, long batchDeadline) {
    long timeoutNanos = recipientTimeout.toNanos();
    while (true) {
      long now = System.nanoTime();
      long waitNanos;
      if (task.isStarted()) {
        waitNanos = task.startedNanos() + timeoutNanos - now;
      } else if (now - batchDeadline >= 0) {
        future.cancel(true);
        return timedOut(task, "not dispatched before batch deadline");
      } else {
        waitNanos = TimeUnit.MILLISECONDS.toNanos(QUEUED_POLL_MS);
      }
      try {
        return future.get(Math.max(0L, waitNanos), TimeUnit.NANOSECONDS);
      } catch (TimeoutException e) {
        if (task.isStarted() && System.nanoTime() - (task.startedNanos() + timeoutNanos) >= 0) {
          future.cancel(true);
          return timedOut(task, "timed out after " + recipientTimeout.toMillis() + " ms");
        }
      } catch (CancellationException e) {
        return timedOut(task, "cancelled");
      } catch (ExecutionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        logger.log(Level.WARNING, "Delivery task to " + task.address() + " failed", cause);
        return DeliveryAttempt.failed(task.messageId(), task.address(),
            String.valueOf(cause.getMessage()), elapsedSinceStart(task), task.retriesSoFar());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        future.cancel(true);
        return timedOut(task, "interrupted while waiting");
      }
    }
  }

  private DeliveryAttempt timedOut(DeliveryTask task, String reason) {
    logger.log(Level.WARNING, "Delivery to {0} {1}", new Object[]{task.address(), reason});
    return DeliveryAttempt.failed(task.messageId(), task.address(), reason,
        elapsedSinceStart(task), task.retriesSoFar());
  }

  private static long elapsedSinceStart(DeliveryTask task) {
    return task.isStarted()
        ? TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - task.startedNanos()) : 0L;
  }

  private void persistAttempts(String messageId, List<DeliveryAttempt> attempts) {
    try {
      ledger.saveDeliveryAttempts(attempts);
    } catch (StoreUnavailableException e) {
      logger.log(Level.SEVERE, "Failed to record " + attempts.size()
          + " delivery attempts for " + messageId + "; outcomes: " + attempts, e);
    }
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new IllegalStateException("BroadcastEngine has been closed");
    }
  }

  /**
   * Stops accepting work and waits up to the drain timeout for in-flight deliveries.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; interrupting in-flight deliveries");
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link BroadcastEngine}. */
  public static final class Builder {
    private RecipientDirectory directory;
    private MessageLedger ledger;
    private Transport transport;
    private RetryPolicy retryPolicy;
    private int maxAttempts = 3;
    private int workerCount = 10;
    private Duration recipientTimeout = Duration.ofSeconds(30);
    private MetricsExporter metrics;
    private MessageFormatter formatter;
    private Clock clock;
    private long drainTimeoutMs = 5000;
    private final List<BroadcastHook> hooks = new ArrayList<>();

    private Builder() {}

    /**
     * Sets the member directory used to resolve senders and recipients.
     *
     * <p><b>Required.</b>
     *
     * @param directory the directory
     * @return this builder
     */
    public Builder directory(RecipientDirectory directory) {
      this.directory = directory;
      return this;
    }

    /**
     * Sets the ledger that stores broadcasts and delivery attempts.
     *
     * <p><b>Required.</b>
     *
     * @param ledger the ledger
     * @return this builder
     */
    public Builder ledger(MessageLedger ledger) {
      this.ledger = ledger;
      return this;
    }

    /**
     * Sets the transport used for every outbound send.
     *
     * <p><b>Required.</b> Must be safe for concurrent use.
     *
     * @param transport the transport
     * @return this builder
     */
    public Builder transport(Transport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Sets the delay policy between attempts to one recipient.
     *
     * <p>Optional. Defaults to {@link LinearBackoffRetryPolicy} with a 1 second base.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the number of transport calls per recipient before it is recorded as failed.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     *
     * @param maxAttempts attempts per recipient
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the number of concurrent sends, independent of roster size.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &ge; 1.
     *
     * @param workerCount fan-out pool size
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets how long one recipient may take, retries included, once its delivery starts.
     *
     * <p>Optional. Defaults to 30 seconds. Must be positive.
     *
     * @param recipientTimeout per-recipient timeout
     * @return this builder
     */
    public Builder recipientTimeout(Duration recipientTimeout) {
      this.recipientTimeout = recipientTimeout;
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
     * <p>Optional. Defaults to {@link MessageFormatter}.
     *
     * @param formatter the message formatter
     * @return this builder
     */
    public Builder formatter(MessageFormatter formatter) {
      this.formatter = formatter;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock clock used for broadcast timestamps
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Appends a hook called after each new broadcast.
     *
     * @param hook the hook
     * @return this builder
     */
    public Builder hook(BroadcastHook hook) {
      this.hooks.add(Objects.requireNonNull(hook, "hook"));
      return this;
    }

    /**
     * Sets how long {@link #close()} waits for in-flight deliveries.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Builds the engine and starts its worker pool.
     *
     * @throws NullPointerException     if {@code directory}, {@code ledger} or
     *                                  {@code transport} is null
     * @throws IllegalArgumentException if a numeric setting is out of range
     */
    public BroadcastEngine build() {
      return new BroadcastEngine(this);
    }
  }
}
