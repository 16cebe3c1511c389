package chorus.model;

import java.util.Objects;

/** Display identity of a registered sender. */
public record SenderIdentity(String name, boolean admin) {

  public SenderIdentity {
    Objects.requireNonNull(name, "name");
  }
}
