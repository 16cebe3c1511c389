/**
 * Reaction handling: recognizing reaction phrases, resolving their target broadcast,
 * applying toggle/replace/remove transitions and deciding when a summary update is sent.
 *
 * @see chorus.reaction.ReactionPatternDetector
 * @see chorus.reaction.TargetMessageResolver
 * @see chorus.reaction.ReactionAggregator
 * @see chorus.reaction.UpdateTimingPolicy
 */
package chorus.reaction;
