package chorus.spi;

/**
 * Sends one text message to one address.
 *
 * <p>Implementations must be safe to call concurrently from multiple fan-out workers.
 * A thrown {@link RuntimeException} is treated like a failed {@link SendResult}.
 *
 * @see chorus.transport.LoggingTransport
 */
@FunctionalInterface
public interface Transport {

  SendResult send(String address, String text);
}
