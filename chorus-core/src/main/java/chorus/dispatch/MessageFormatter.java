package chorus.dispatch;

import chorus.model.Broadcast;

import java.util.List;

/**
 * Builds the text recipients see.
 */
public final class MessageFormatter {
  static final String FOOTER = "📱 Reply to join the conversation!";
  private static final int PREVIEW_LENGTH = 40;

  /**
   * Sender prefix, body, one line per attachment link, reaction summary if any, footer.
   */
  public String formatBroadcast(Broadcast broadcast, List<String> attachmentLinks) {
    StringBuilder sb = new StringBuilder();
    sb.append("💬 ").append(broadcast.senderName()).append(":\n");
    sb.append(broadcast.text());
    for (String link : attachmentLinks) {
      sb.append("\n📎 ").append(link);
    }
    if (broadcast.hasReactionSummary()) {
      sb.append("\n\n").append(broadcast.reactionSummary());
    }
    sb.append("\n\n").append(FOOTER);
    return sb.toString();
  }

  /**
   * Update sent when a broadcast's reaction summary changes enough to be worth a message.
   */
  public String formatReactionUpdate(Broadcast broadcast) {
    StringBuilder sb = new StringBuilder();
    sb.append("📊 ").append(broadcast.senderName()).append("'s message \"")
        .append(preview(broadcast.text())).append("\"\n");
    sb.append(broadcast.hasReactionSummary() ? broadcast.reactionSummary() : "No reactions yet");
    return sb.toString();
  }

  /**
   * Shortens a message body to a one-line preview.
   */
  public static String preview(String text) {
    String oneLine = text.replaceAll("\\s+", " ").strip();
    if (oneLine.length() <= PREVIEW_LENGTH) {
      return oneLine;
    }
    int end = PREVIEW_LENGTH;
    if (Character.isHighSurrogate(oneLine.charAt(end - 1))) {
      end--;
    }
    return oneLine.substring(0, end) + "...";
  }
}
