package chorus.testing;

import chorus.model.Recipient;
import chorus.model.SenderIdentity;
import chorus.spi.RecipientDirectory;
import chorus.spi.StoreUnavailableException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class InMemoryRecipientDirectory implements RecipientDirectory {
  private final Map<String, Recipient> members = new LinkedHashMap<>();
  public volatile boolean unavailable;

  public synchronized InMemoryRecipientDirectory add(String address, String name, boolean admin) {
    members.put(address, new Recipient(address, name, admin));
    return this;
  }

  public synchronized void remove(String address) {
    members.remove(address);
  }

  @Override
  public synchronized List<Recipient> activeRecipients(String excludeAddress) {
    if (unavailable) {
      throw new StoreUnavailableException("directory down");
    }
    List<Recipient> out = new ArrayList<>();
    for (Recipient r : members.values()) {
      if (!r.address().equals(excludeAddress)) {
        out.add(r);
      }
    }
    return out;
  }

  @Override
  public synchronized Optional<SenderIdentity> identity(String address) {
    if (unavailable) {
      throw new StoreUnavailableException("directory down");
    }
    Recipient r = members.get(address);
    return r == null ? Optional.empty() : Optional.of(new SenderIdentity(r.name(), r.admin()));
  }
}
