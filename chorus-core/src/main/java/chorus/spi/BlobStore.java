package chorus.spi;

import java.io.IOException;

/**
 * Stores attachment bytes and returns a publicly reachable link.
 */
@FunctionalInterface
public interface BlobStore {

  /**
   * @param content  raw bytes
   * @param mimeType content type, e.g. {@code image/jpeg}
   * @return public URL of the stored object
   * @throws IOException if the object could not be stored
   */
  String store(byte[] content, String mimeType) throws IOException;
}
