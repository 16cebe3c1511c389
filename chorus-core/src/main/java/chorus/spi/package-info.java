/**
 * Service provider interfaces for the collaborators the engine consumes: the member
 * directory, the message ledger, the outbound transport, attachment storage and metrics.
 */
package chorus.spi;
