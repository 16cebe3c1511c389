package chorus.transport;

import chorus.spi.SendResult;
import chorus.spi.Transport;
import chorus.util.MessageIds;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transport for running without an SMS provider: logs every message and reports success.
 */
public final class LoggingTransport implements Transport {
  private static final Logger logger = Logger.getLogger(LoggingTransport.class.getName());

  @Override
  public SendResult send(String address, String text) {
    logger.log(Level.INFO, "[TEST MODE] Would send to {0}: {1}", new Object[]{address, text});
    return SendResult.success("test-" + MessageIds.next());
  }
}
