package chorus.digest;

import chorus.dispatch.MessageFormatter;
import chorus.model.Broadcast;
import chorus.reaction.ReactionSummaryFormatter;

import java.util.List;
import java.util.Map;

/**
 * Renders pause and daily digests.
 */
public class DigestFormatter {

  /** Reactions on one broadcast, counted per emoji in summary order. */
  public record Entry(Broadcast broadcast, Map<String, Integer> counts, int total) {
  }

  /**
   * Pause digest: every broadcast that received reactions, in the order given.
   */
  public String formatPause(List<Entry> entries) {
    StringBuilder sb = new StringBuilder("🔔 While things were quiet:\n");
    for (Entry entry : entries) {
      appendEntry(sb.append('\n'), entry);
    }
    return sb.toString();
  }

  /**
   * Daily digest: the most reacted broadcasts, numbered.
   */
  public String formatDaily(List<Entry> top, int totalReactions) {
    StringBuilder sb = new StringBuilder("🌙 Today's reactions (")
        .append(totalReactions).append(totalReactions == 1 ? " reaction" : " reactions")
        .append("):\n");
    int rank = 1;
    for (Entry entry : top) {
      sb.append('\n').append(rank++).append(". ");
      appendEntry(sb, entry);
    }
    return sb.toString();
  }

  private static void appendEntry(StringBuilder sb, Entry entry) {
    sb.append(entry.broadcast().senderName()).append(": \"")
        .append(MessageFormatter.preview(entry.broadcast().text())).append("\" ")
        .append(ReactionSummaryFormatter.renderCounts(entry.counts()));
  }
}
