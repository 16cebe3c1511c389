package chorus.dispatch;

/**
 * Waits {@code baseDelay × attempts} between attempts: 1s, 2s, ... with the default base.
 */
public final class LinearBackoffRetryPolicy implements RetryPolicy {
  public static final long DEFAULT_BASE_DELAY_MS = 1000;

  private final long baseDelayMs;

  public LinearBackoffRetryPolicy() {
    this(DEFAULT_BASE_DELAY_MS);
  }

  /**
   * @param baseDelayMs delay after the first failed attempt (milliseconds)
   */
  public LinearBackoffRetryPolicy(long baseDelayMs) {
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    // saturate instead of overflowing
    if (baseDelayMs != 0 && attempts > Long.MAX_VALUE / baseDelayMs) {
      return Long.MAX_VALUE;
    }
    return baseDelayMs * attempts;
  }
}
