package chorus.dispatch;

import chorus.model.Broadcast;

/**
 * Callback invoked by {@link BroadcastEngine} after a new broadcast has been persisted
 * and fanned out. Not invoked for digests or reaction updates.
 *
 * <p>Exceptions thrown by a hook are logged and do not affect the outcome.
 *
 * @see chorus.digest.DigestScheduler
 */
@FunctionalInterface
public interface BroadcastHook {

  void afterBroadcast(Broadcast broadcast);

  BroadcastHook NOOP = broadcast -> {
  };
}
