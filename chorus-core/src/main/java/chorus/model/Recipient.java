package chorus.model;

import java.util.Objects;

/** An active roster member as returned by the directory. */
public record Recipient(String address, String name, boolean admin) {

  public Recipient {
    Objects.requireNonNull(address, "address");
    Objects.requireNonNull(name, "name");
  }
}
