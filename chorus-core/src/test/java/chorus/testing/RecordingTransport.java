package chorus.testing;

import chorus.spi.SendResult;
import chorus.spi.Transport;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Records every send. Addresses in {@link #failing} always fail; addresses in
 * {@link #hanging} block until interrupted.
 */
public class RecordingTransport implements Transport {
  public final List<Sent> sent = new CopyOnWriteArrayList<>();
  public final Set<String> failing = ConcurrentHashMap.newKeySet();
  public final Set<String> hanging = ConcurrentHashMap.newKeySet();
  public final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
  private final AtomicInteger ids = new AtomicInteger();

  public record Sent(String address, String text) {
  }

  @Override
  public SendResult send(String address, String text) {
    calls.computeIfAbsent(address, a -> new AtomicInteger()).incrementAndGet();
    if (hanging.contains(address)) {
      try {
        Thread.sleep(60_000);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return SendResult.failure("interrupted");
    }
    if (failing.contains(address)) {
      return SendResult.failure("carrier rejected " + address);
    }
    sent.add(new Sent(address, text));
    return SendResult.success("sm-" + ids.incrementAndGet());
  }

  public int callsTo(String address) {
    AtomicInteger n = calls.get(address);
    return n == null ? 0 : n.get();
  }

  public List<String> textsTo(String address) {
    return sent.stream().filter(s -> s.address().equals(address)).map(Sent::text).toList();
  }
}
