package chorus.util;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Mutual exclusion scoped to a single key. Threads holding different keys never block
 * each other. Entries are reference counted and removed once no thread holds or waits
 * for them.
 *
 * <p>This class is thread-safe.
 *
 * @param <K> key type; must implement {@code equals}/{@code hashCode}
 */
public final class KeyedLocks<K> {
  private final Map<K, Entry> locks = new ConcurrentHashMap<>();

  /**
   * Runs {@code action} while holding the lock for {@code key}.
   *
   * @return the value produced by {@code action}
   */
  public <T> T withLock(K key, Supplier<T> action) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(action, "action");
    Entry entry = locks.compute(key, (k, existing) -> {
      Entry e = existing == null ? new Entry() : existing;
      e.users++;
      return e;
    });
    entry.lock.lock();
    try {
      return action.get();
    } finally {
      entry.lock.unlock();
      locks.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
    }
  }

  /** Number of keys currently held or waited for. */
  public int size() {
    return locks.size();
  }

  private static final class Entry {
    private final ReentrantLock lock = new ReentrantLock();
    // guarded by the map's compute lock for this key
    private int users;
  }
}
