package chorus.dispatch;

/**
 * Strategy for the pause between failed transport attempts to one recipient.
 *
 * @see LinearBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

  /**
   * @param attempts attempts made so far (1-based)
   * @return delay in milliseconds before the next attempt (non-negative)
   */
  long computeDelayMs(int attempts);
}
