package chorus.reaction;

import chorus.model.Broadcast;
import chorus.spi.MessageLedger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Finds the recent broadcast a reaction refers to by fuzzy matching its quoted fragment.
 *
 * <p>Candidates are the {@value #CANDIDATE_LIMIT} newest broadcasts inside the lookback
 * window that were not written by the reactor. Each is scored as
 * {@code |common words| / max(|fragment words|, |message words|)} over lower-cased
 * whitespace tokens, plus {@value #SUBSTRING_BONUS} when the fragment occurs in the text
 * ignoring case. The best score above {@value #MIN_SCORE} wins, newest first on ties.
 *
 * <p>When nothing clears the threshold, or the fragment is empty, the newest candidate is
 * returned. An empty result therefore means there were no candidates at all; a
 * low-confidence reaction is still attached to some message.
 */
public final class TargetMessageResolver {
  private static final Logger logger = Logger.getLogger(TargetMessageResolver.class.getName());

  public static final Duration DEFAULT_LOOKBACK = Duration.ofHours(24);
  public static final int CANDIDATE_LIMIT = 10;
  public static final double MIN_SCORE = 0.3;
  public static final double SUBSTRING_BONUS = 0.5;

  private final MessageLedger ledger;
  private final Clock clock;

  public TargetMessageResolver(MessageLedger ledger) {
    this(ledger, Clock.systemUTC());
  }

  public TargetMessageResolver(MessageLedger ledger, Clock clock) {
    this.ledger = Objects.requireNonNull(ledger, "ledger");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public Optional<Broadcast> resolve(String fragment, String reactorAddress) {
    return resolveScored(fragment, reactorAddress, DEFAULT_LOOKBACK).map(ResolvedTarget::broadcast);
  }

  /**
   * @param fragment       quoted target text; empty for a bare emoji
   * @param reactorAddress address of the reactor, whose own broadcasts are skipped
   * @param lookback       how far back to search
   * @return the chosen target, or empty when there are no candidates
   */
  public Optional<ResolvedTarget> resolveScored(String fragment, String reactorAddress, Duration lookback) {
    Objects.requireNonNull(reactorAddress, "reactorAddress");
    Objects.requireNonNull(lookback, "lookback");
    if (lookback.isNegative() || lookback.isZero()) {
      throw new IllegalArgumentException("lookback must be positive");
    }

    Instant since = clock.instant().minus(lookback);
    List<Broadcast> candidates = ledger.recentBroadcasts(since, reactorAddress, CANDIDATE_LIMIT);
    if (candidates.isEmpty()) {
      return Optional.empty();
    }
    Broadcast newest = newest(candidates);
    if (fragment == null || fragment.isBlank()) {
      return Optional.of(new ResolvedTarget(newest, 0.0, true));
    }

    Broadcast best = null;
    double bestScore = MIN_SCORE;
    for (Broadcast candidate : candidates) {
      double score = score(fragment, candidate.text());
      if (score > bestScore
          || (best != null && score == bestScore && candidate.createdAt().isAfter(best.createdAt()))) {
        best = candidate;
        bestScore = score;
      }
    }
    if (best == null) {
      logger.log(Level.FINE, "No candidate above {0} for fragment; falling back to {1}",
          new Object[]{MIN_SCORE, newest.id()});
      return Optional.of(new ResolvedTarget(newest, 0.0, true));
    }
    return Optional.of(new ResolvedTarget(best, bestScore, false));
  }

  /**
   * Similarity of a fragment to a message text.
   */
  public static double score(String fragment, String text) {
    Set<String> fragmentWords = words(fragment);
    Set<String> messageWords = words(text);
    int denominator = Math.max(fragmentWords.size(), messageWords.size());
    double score = 0.0;
    if (denominator > 0) {
      Set<String> common = new HashSet<>(fragmentWords);
      common.retainAll(messageWords);
      score = (double) common.size() / denominator;
    }
    if (!fragment.isEmpty()
        && text.toLowerCase(Locale.ROOT).contains(fragment.toLowerCase(Locale.ROOT))) {
      score += SUBSTRING_BONUS;
    }
    return score;
  }

  private static Set<String> words(String text) {
    String trimmed = text.strip();
    if (trimmed.isEmpty()) {
      return Set.of();
    }
    return Arrays.stream(trimmed.toLowerCase(Locale.ROOT).split("\\s+"))
        .collect(Collectors.toSet());
  }

  private static Broadcast newest(List<Broadcast> candidates) {
    Broadcast newest = candidates.get(0);
    for (Broadcast candidate : candidates) {
      if (candidate.createdAt().isAfter(newest.createdAt())) {
        newest = candidate;
      }
    }
    return newest;
  }
}
