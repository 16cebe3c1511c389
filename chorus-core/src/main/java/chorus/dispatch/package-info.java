/**
 * Outbound fan-out of broadcasts and system announcements.
 *
 * <p>{@link chorus.dispatch.BroadcastEngine} delivers one formatted text to the whole active
 * roster on a bounded worker pool, retrying each recipient with linear backoff and recording
 * one {@link chorus.model.DeliveryAttempt} per recipient. Per-recipient timeouts keep a hung
 * transport call from stalling the batch.
 *
 * @see chorus.dispatch.BroadcastEngine
 * @see chorus.dispatch.RetryPolicy
 * @see chorus.dispatch.BroadcastHook
 * @see chorus.dispatch.MessageFormatter
 */
package chorus.dispatch;
