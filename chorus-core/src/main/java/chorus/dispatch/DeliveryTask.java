package chorus.dispatch;

import chorus.model.DeliveryAttempt;
import chorus.spi.MetricsExporter;
import chorus.spi.SendResult;
import chorus.spi.Transport;

import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivers one outbound message to one recipient, retrying failed transport calls.
 * Runs on a {@link BroadcastEngine} worker.
 */
final class DeliveryTask implements Callable<DeliveryAttempt> {
  private static final Logger logger = Logger.getLogger(DeliveryTask.class.getName());

  private final String messageId;
  private final String address;
  private final String text;
  private final Transport transport;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;
  private final MetricsExporter metrics;

  private final AtomicInteger attemptsMade = new AtomicInteger();
  private volatile long startedNanos;
  private volatile boolean started;

  DeliveryTask(String messageId, String address, String text, Transport transport,
      RetryPolicy retryPolicy, int maxAttempts, MetricsExporter metrics) {
    this.messageId = messageId;
    this.address = address;
    this.text = text;
    this.transport = transport;
    this.retryPolicy = retryPolicy;
    this.maxAttempts = maxAttempts;
    this.metrics = metrics;
  }

  @Override
  public DeliveryAttempt call() {
    startedNanos = System.nanoTime();
    started = true;
    String lastError = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      attemptsMade.set(attempt);
      SendResult result = sendOnce();
      if (result.ok()) {
        logger.log(Level.FINE, "Delivered {0} to {1} (providerId={2}, attempt={3})",
            new Object[]{messageId, address, result.providerId(), attempt});
        return DeliveryAttempt.delivered(messageId, address, result.providerId(), elapsedMs(), attempt - 1);
      }
      lastError = result.error();
      if (attempt < maxAttempts) {
        metrics.incrementDeliveryRetry();
        long delayMs = retryPolicy.computeDelayMs(attempt);
        logger.log(Level.FINE, "Attempt {0} to {1} failed: {2}; retrying in {3} ms",
            new Object[]{attempt, address, lastError, delayMs});
        try {
          TimeUnit.MILLISECONDS.sleep(delayMs);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return DeliveryAttempt.failed(messageId, address, "interrupted: " + lastError, elapsedMs(), attempt - 1);
        }
      }
    }
    logger.log(Level.WARNING, "Delivery of {0} to {1} failed after {2} attempts: {3}",
        new Object[]{messageId, address, maxAttempts, lastError});
    return DeliveryAttempt.failed(messageId, address, lastError, elapsedMs(), maxAttempts - 1);
  }

  private SendResult sendOnce() {
    try {
      SendResult result = transport.send(address, text);
      return result != null ? result : SendResult.failure("transport returned no result");
    } catch (RuntimeException e) {
      String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      return SendResult.failure(message);
    }
  }

  private long elapsedMs() {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
  }

  String messageId() {
    return messageId;
  }

  String address() {
    return address;
  }

  boolean isStarted() {
    return started;
  }

  /** Only meaningful once {@link #isStarted()} is true. */
  long startedNanos() {
    return startedNanos;
  }

  int retriesSoFar() {
    return Math.max(0, attemptsMade.get() - 1);
  }
}
