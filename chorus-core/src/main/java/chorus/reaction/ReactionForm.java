package chorus.reaction;

/** Which of the recognized reaction phrasings matched. */
public enum ReactionForm {
  /** {@code Loved "text"}, {@code Laughed at "text"}, ... */
  VERB,
  /** {@code Reacted 😂 to "text"} */
  REACTED,
  /** A message made only of emoji. */
  BARE_EMOJI,
  /** {@code 😂 to "text"} */
  EMOJI_TO
}
