package chorus.util;

import com.github.f4b6a3.ulid.UlidCreator;

/**
 * Generates monotonic ULID identifiers for broadcasts and synthetic outbound messages.
 */
public final class MessageIds {

  public static String next() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  private MessageIds() {}
}
