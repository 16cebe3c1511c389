package chorus.digest;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Timer state of a {@link DigestScheduler}. Read and written only on the scheduler thread;
 * other threads reach it by submitting tasks to that thread.
 */
final class SchedulerState {
  private ScheduledFuture<?> pendingPause;
  private Instant lastBroadcastAt;
  private Instant nextDailyRun;
  private long resets;

  /**
   * Replaces the pending pause digest. The previous one, if still waiting, never fires.
   */
  void replacePendingPause(ScheduledFuture<?> next, Instant broadcastAt) {
    if (pendingPause != null) {
      pendingPause.cancel(false);
    }
    pendingPause = next;
    lastBroadcastAt = broadcastAt;
    resets++;
  }

  /** Called by the pause task itself once it fires. */
  void pauseFired() {
    pendingPause = null;
  }

  boolean hasPendingPause() {
    return pendingPause != null && !pendingPause.isDone();
  }

  Instant lastBroadcastAt() {
    return lastBroadcastAt;
  }

  long resets() {
    return resets;
  }

  Instant nextDailyRun() {
    return nextDailyRun;
  }

  void nextDailyRun(Instant nextDailyRun) {
    this.nextDailyRun = nextDailyRun;
  }
}
