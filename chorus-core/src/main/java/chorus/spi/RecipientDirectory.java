package chorus.spi;

import chorus.model.Recipient;
import chorus.model.SenderIdentity;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the flat member roster.
 *
 * <p>Implementations throw {@link StoreUnavailableException} when the backing store cannot
 * be reached; callers treat that as batch-fatal.
 */
public interface RecipientDirectory {

  /**
   * Returns all active members, optionally leaving one address out.
   *
   * @param excludeAddress address to omit, or {@code null} to return everyone
   * @return active recipients; never {@code null}
   */
  List<Recipient> activeRecipients(String excludeAddress);

  /**
   * Resolves the display identity of a sender.
   *
   * @param address sender address
   * @return identity, or empty when the address is not registered
   */
  Optional<SenderIdentity> identity(String address);
}
