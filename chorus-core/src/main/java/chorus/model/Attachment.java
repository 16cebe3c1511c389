package chorus.model;

import java.util.Objects;

/**
 * Raw media received with an inbound message, before it is turned into a link.
 */
public record Attachment(byte[] content, String mimeType) {

  public Attachment {
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(mimeType, "mimeType");
  }
}
