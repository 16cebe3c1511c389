/**
 * Built-in {@link chorus.spi.Transport} implementations.
 */
package chorus.transport;
