package chorus;

import chorus.dispatch.BroadcastEngine;
import chorus.dispatch.BroadcastOutcome;
import chorus.dispatch.MessageFormatter;
import chorus.model.Attachment;
import chorus.model.Broadcast;
import chorus.model.SenderIdentity;
import chorus.reaction.AggregationResult;
import chorus.reaction.DetectedReaction;
import chorus.reaction.ReactionAggregator;
import chorus.reaction.ReactionPatternDetector;
import chorus.reaction.ResolvedTarget;
import chorus.reaction.TargetMessageResolver;
import chorus.spi.BlobStore;
import chorus.spi.MessageLedger;
import chorus.spi.RecipientDirectory;
import chorus.spi.StoreUnavailableException;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for one inbound text from the ingress layer.
 *
 * <p>Decides between a command, a reaction and a new broadcast, and returns the reply to
 * send back to the sender, if any. Regular members get no reply for broadcasts and
 * reactions; admins get a confirmation. Help text and rejections are returned to anyone.
 *
 * <p>Text that looks like a command but is not one (e.g. {@code STATS}) is broadcast.
 */
public final class InboundMessageHandler {
  private static final Logger logger = Logger.getLogger(InboundMessageHandler.class.getName());

  static final Set<String> HELP_COMMANDS = Set.of("HELP", "H", "?");
  static final String RECENT_COMMAND = "RECENT";

  /** Reply to a sender that is not an active member. */
  public static final String REJECTION = "❌ This number is not registered. Contact an admin to be added.";
  /** Reply when the store is unreachable. */
  public static final String TRY_AGAIN = "⚠️ Something went wrong. Please try again in a few minutes.";
  static final String NO_MEMBERS = "No members found to send to.";

  private static final int RECENT_PREVIEW_LENGTH = 50;
  private static final DateTimeFormatter RECENT_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

  private final RecipientDirectory directory;
  private final MessageLedger ledger;
  private final BroadcastEngine engine;
  private final ReactionAggregator aggregator;
  private final ReactionPatternDetector detector;
  private final TargetMessageResolver resolver;
  private final BlobStore blobStore;
  private final Duration lookback;
  private final int recentLimit;
  private final Clock clock;

  private InboundMessageHandler(Builder builder) {
    this.directory = Objects.requireNonNull(builder.directory, "directory");
    this.ledger = Objects.requireNonNull(builder.ledger, "ledger");
    this.engine = Objects.requireNonNull(builder.engine, "engine");
    this.aggregator = Objects.requireNonNull(builder.aggregator, "aggregator");
    this.clock = builder.clock != null ? builder.clock : Clock.systemDefaultZone();
    this.detector = builder.detector != null ? builder.detector : new ReactionPatternDetector();
    this.resolver = builder.resolver != null ? builder.resolver : new TargetMessageResolver(ledger, clock);
    this.blobStore = builder.blobStore;
    this.lookback = builder.lookback != null ? builder.lookback : TargetMessageResolver.DEFAULT_LOOKBACK;
    if (lookback.isNegative() || lookback.isZero()) {
      throw new IllegalArgumentException("lookback must be positive");
    }
    if (builder.recentLimit < 1) {
      throw new IllegalArgumentException("recentLimit must be >= 1");
    }
    this.recentLimit = builder.recentLimit;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Handles one inbound message.
   *
   * @param senderAddress address the message came from
   * @param text          message body, possibly empty when only media was sent
   * @param attachments   media received with the message, possibly empty
   * @return the reply for the sender, or empty for none
   */
  public Optional<String> handle(String senderAddress, String text, List<Attachment> attachments) {
    Objects.requireNonNull(senderAddress, "senderAddress");
    String body = text == null ? "" : text.strip();
    List<Attachment> media = attachments == null ? List.of() : attachments;
    try {
      Optional<SenderIdentity> identity = directory.identity(senderAddress);
      if (identity.isEmpty()) {
        logger.log(Level.INFO, "Rejected message from unregistered sender {0}", senderAddress);
        return Optional.of(REJECTION);
      }
      SenderIdentity sender = identity.get();

      String command = body.toUpperCase(Locale.ROOT);
      if (HELP_COMMANDS.contains(command)) {
        return Optional.of(helpText(sender.admin()));
      }
      if (sender.admin() && RECENT_COMMAND.equals(command)) {
        return Optional.of(recentBroadcasts());
      }

      if (media.isEmpty()) {
        Optional<DetectedReaction> detected = detector.detect(body);
        if (detected.isPresent()) {
          Optional<ResolvedTarget> target =
              resolver.resolveScored(detected.get().targetFragment(), senderAddress, lookback);
          if (target.isPresent()) {
            return onReaction(senderAddress, sender, detected.get(), target.get());
          }
          logger.log(Level.FINE, "No broadcast to attach reaction from {0}; sending as a message",
              senderAddress);
        }
      }
      return onBroadcast(senderAddress, sender, body, media);
    } catch (UnregisteredSenderException e) {
      return Optional.of(REJECTION);
    } catch (StoreUnavailableException e) {
      logger.log(Level.SEVERE, "Store unavailable while handling message from " + senderAddress, e);
      return Optional.of(TRY_AGAIN);
    }
  }

  private Optional<String> onReaction(String senderAddress, SenderIdentity sender,
      DetectedReaction detected, ResolvedTarget target) {
    if (target.fallback() && detected.hasFragment()) {
      logger.log(Level.INFO, "Reaction fragment \"{0}\" matched nothing; attached to newest broadcast {1}",
          new Object[]{detected.targetFragment(), target.broadcast().id()});
    }
    AggregationResult result = aggregator.apply(target.broadcast(), senderAddress, sender.name(), detected.emoji());
    boolean updateSent = false;
    if (result.sendUpdate()) {
      updateSent = sendReactionUpdate(senderAddress, result.broadcast());
    }
    if (!sender.admin()) {
      return Optional.empty();
    }
    StringBuilder reply = new StringBuilder("✅ Reaction ")
        .append(result.action().label()).append(": ").append(detected.emoji())
        .append(" on \"").append(MessageFormatter.preview(result.broadcast().text())).append('"');
    if (updateSent) {
      reply.append("\n📊 ").append(result.summary().isEmpty() ? "No reactions yet" : result.summary());
    }
    return Optional.of(reply.toString());
  }

  private boolean sendReactionUpdate(String reactorAddress, Broadcast broadcast) {
    try {
      engine.announce(engine.formatter().formatReactionUpdate(broadcast), reactorAddress);
      aggregator.markUpdateSent(broadcast.id());
      return true;
    } catch (NoRecipientsException e) {
      logger.log(Level.FINE, "Reaction update for {0} had no recipients", broadcast.id());
      return false;
    }
  }

  private Optional<String> onBroadcast(String senderAddress, SenderIdentity sender, String body,
      List<Attachment> media) {
    List<String> links = new ArrayList<>(media.size());
    int failedMedia = storeAttachments(senderAddress, media, links);
    String text = body;
    if (failedMedia > 0) {
      String note = "(📎 " + failedMedia + (failedMedia == 1 ? " attachment" : " attachments")
          + " could not be included)";
      text = text.isEmpty() ? note : text + "\n" + note;
    }
    if (text.isEmpty() && links.isEmpty()) {
      logger.log(Level.FINE, "Ignoring empty message from {0}", senderAddress);
      return Optional.empty();
    }

    BroadcastOutcome outcome;
    try {
      outcome = engine.broadcast(senderAddress, text, links);
    } catch (NoRecipientsException e) {
      logger.log(Level.WARNING, "Broadcast from {0} had no recipients", senderAddress);
      return sender.admin() ? Optional.of(NO_MEMBERS) : Optional.empty();
    }
    if (!sender.admin()) {
      return Optional.empty();
    }
    StringBuilder reply = new StringBuilder("✅ Message broadcast to ")
        .append(outcome.sentCount()).append(outcome.sentCount() == 1 ? " member" : " members");
    if (outcome.failedCount() > 0) {
      reply.append("\n⚠️ Failed deliveries: ").append(outcome.failedCount());
    }
    return Optional.of(reply.toString());
  }

  private int storeAttachments(String senderAddress, List<Attachment> media, List<String> links) {
    int failed = 0;
    for (Attachment attachment : media) {
      if (blobStore == null) {
        failed++;
        continue;
      }
      try {
        links.add(blobStore.store(attachment.content(), attachment.mimeType()));
      } catch (IOException | RuntimeException e) {
        logger.log(Level.WARNING, "Failed to store " + attachment.mimeType()
            + " attachment from " + senderAddress, e);
        failed++;
      }
    }
    if (blobStore == null && failed > 0) {
      logger.log(Level.WARNING, "No blob store configured; dropped {0} attachments from {1}",
          new Object[]{failed, senderAddress});
    }
    return failed;
  }

  static String helpText(boolean admin) {
    StringBuilder sb = new StringBuilder();
    sb.append("📢 HOW IT WORKS:\n");
    sb.append("• Text anything → goes to every member\n");
    sb.append("• React with an emoji, or Loved \"...\" → counted on that message\n\n");
    sb.append("📱 COMMANDS:\n");
    sb.append("• HELP - Show this message\n\n");
    if (admin) {
      sb.append("👑 ADMIN COMMANDS:\n");
      sb.append("• RECENT - View recent broadcasts\n\n");
    }
    sb.append("💬 Just type your message to broadcast to everyone!");
    return sb.toString();
  }

  private String recentBroadcasts() {
    List<Broadcast> recent = ledger.recentBroadcasts(Instant.EPOCH, null, recentLimit);
    if (recent.isEmpty()) {
      return "No recent broadcasts.";
    }
    DateTimeFormatter time = RECENT_TIME.withZone(clock.getZone());
    StringBuilder sb = new StringBuilder("📋 Recent Broadcasts:\n");
    for (Broadcast broadcast : recent) {
      String preview = broadcast.text();
      if (preview.length() > RECENT_PREVIEW_LENGTH) {
        int end = Character.isHighSurrogate(preview.charAt(RECENT_PREVIEW_LENGTH - 1))
            ? RECENT_PREVIEW_LENGTH - 1 : RECENT_PREVIEW_LENGTH;
        preview = preview.substring(0, end) + "...";
      }
      sb.append("\n👤 ").append(broadcast.senderName());
      sb.append("\n💬 ").append(preview);
      if (broadcast.hasReactionSummary()) {
        sb.append("\n📊 ").append(broadcast.reactionSummary());
      }
      sb.append("\n🕐 ").append(time.format(broadcast.createdAt())).append('\n');
    }
    return sb.toString();
  }

  /** Builder for {@link InboundMessageHandler}. */
  public static final class Builder {
    private RecipientDirectory directory;
    private MessageLedger ledger;
    private BroadcastEngine engine;
    private ReactionAggregator aggregator;
    private ReactionPatternDetector detector;
    private TargetMessageResolver resolver;
    private BlobStore blobStore;
    private Duration lookback;
    private int recentLimit = 5;
    private Clock clock;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder directory(RecipientDirectory directory) {
      this.directory = directory;
      return this;
    }

    /** <b>Required.</b> */
    public Builder ledger(MessageLedger ledger) {
      this.ledger = ledger;
      return this;
    }

    /** <b>Required.</b> */
    public Builder engine(BroadcastEngine engine) {
      this.engine = engine;
      return this;
    }

    /** <b>Required.</b> */
    public Builder aggregator(ReactionAggregator aggregator) {
      this.aggregator = aggregator;
      return this;
    }

    /** Optional. Defaults to {@link ReactionPatternDetector}. */
    public Builder detector(ReactionPatternDetector detector) {
      this.detector = detector;
      return this;
    }

    /** Optional. Defaults to a {@link TargetMessageResolver} over the ledger. */
    public Builder resolver(TargetMessageResolver resolver) {
      this.resolver = resolver;
      return this;
    }

    /**
     * Sets where attachments are stored. Without one, attachments are replaced by a note.
     *
     * <p>Optional.
     */
    public Builder blobStore(BlobStore blobStore) {
      this.blobStore = blobStore;
      return this;
    }

    /** Optional. Defaults to {@link TargetMessageResolver#DEFAULT_LOOKBACK}. */
    public Builder lookback(Duration lookback) {
      this.lookback = lookback;
      return this;
    }

    /** Optional. Number of broadcasts listed by {@code RECENT}, defaults to {@code 5}. */
    public Builder recentLimit(int recentLimit) {
      this.recentLimit = recentLimit;
      return this;
    }

    /** Optional. Defaults to {@link Clock#systemDefaultZone()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public InboundMessageHandler build() {
      return new InboundMessageHandler(this);
    }
  }
}
