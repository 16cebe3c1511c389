/**
 * Immutable records for broadcasts, reactions and delivery attempts.
 *
 * @see chorus.model.Broadcast
 * @see chorus.model.Reaction
 * @see chorus.model.DeliveryAttempt
 */
package chorus.model;
