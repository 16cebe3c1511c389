package chorus.reaction;

import chorus.model.Reaction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders the count summary of active reactions, e.g. {@code "3 reactions: ❤️×2 👍"}.
 *
 * <p>Emoji are ordered by count descending, then by emoji string. The multiplier is
 * omitted for a count of one. Zero active reactions render as the empty string.
 */
public final class ReactionSummaryFormatter {

  public static String format(Collection<Reaction> reactions) {
    return render(countActive(reactions));
  }

  /**
   * Counts active reactions per emoji in summary order.
   */
  public static Map<String, Integer> countActive(Collection<Reaction> reactions) {
    Map<String, Integer> counts = new TreeMap<>();
    for (Reaction reaction : reactions) {
      if (reaction.active()) {
        counts.merge(reaction.emoji(), 1, Integer::sum);
      }
    }
    return sortByCount(counts);
  }

  /**
   * Renders pre-computed counts; {@code counts} must already be in summary order.
   */
  public static String render(Map<String, Integer> counts) {
    int total = 0;
    for (int n : counts.values()) {
      total += n;
    }
    if (total == 0) {
      return "";
    }
    StringBuilder sb = new StringBuilder();
    sb.append(total).append(total == 1 ? " reaction:" : " reactions:");
    sb.append(' ').append(renderCounts(counts));
    return sb.toString();
  }

  /** Renders only the emoji counts, e.g. {@code "❤️×2 👍"}. */
  public static String renderCounts(Map<String, Integer> counts) {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, Integer> entry : counts.entrySet()) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      sb.append(entry.getKey());
      if (entry.getValue() > 1) {
        sb.append('×').append(entry.getValue());
      }
    }
    return sb.toString();
  }

  static Map<String, Integer> sortByCount(Map<String, Integer> counts) {
    List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
    entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed()
        .thenComparing(Map.Entry.comparingByKey()));
    Map<String, Integer> sorted = new LinkedHashMap<>();
    for (Map.Entry<String, Integer> entry : entries) {
      sorted.put(entry.getKey(), entry.getValue());
    }
    return sorted;
  }

  private ReactionSummaryFormatter() {}
}
