/**
 * Roster broadcast and reaction aggregation.
 *
 * <h2>Core Design</h2>
 * <p>Every inbound text goes through {@link chorus.InboundMessageHandler}. A text recognized by
 * the {@linkplain chorus.reaction.ReactionPatternDetector detector} as a reaction is attached
 * to a recent broadcast by the {@linkplain chorus.reaction.TargetMessageResolver resolver}
 * and applied by the {@linkplain chorus.reaction.ReactionAggregator aggregator}, which keeps
 * one row per reactor and message and recomputes the message's count summary. An
 * {@linkplain chorus.reaction.UpdateTimingPolicy update timing policy} decides whether the new
 * summary is re-sent. Any other text becomes a broadcast fanned out by the
 * {@linkplain chorus.dispatch.BroadcastEngine engine} on a bounded pool, with retries and a
 * per-recipient timeout. Each broadcast restarts the
 * {@linkplain chorus.digest.DigestScheduler digest scheduler}'s silence timer; a daily digest
 * fires at a fixed time.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>chorus-core</b>: model, SPIs, reactions, dispatch, digests</li>
 *   <li><b>chorus-jdbc</b>: JDBC ledger (H2, MySQL, PostgreSQL) and member directory</li>
 *   <li><b>chorus-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>chorus-spring-boot-starter</b>: auto-configuration under {@code chorus.*}</li>
 * </ul>
 *
 * @see chorus.Chorus
 * @see chorus.InboundMessageHandler
 */
package chorus;
