package agentbroker;

import java.util.Locale;

/**
 * Routing category of a {@link MessageEnvelope}.
 *
 * <p>{@link #ERROR} is reserved for replies synthesized by the broker when a message is
 * rejected by policy. Error envelopes bypass validation so a rejection can never trigger
 * another rejection.
 */
public enum MessageType {
  DIRECT("direct"),
  BROADCAST("broadcast"),
  RESPONSE("response"),
  ERROR("error");

  private final String tag;

  MessageType(String tag) {
    this.tag = tag;
  }

  /**
   * Returns the lowercase string tag used in serialized envelopes and telemetry details.
   *
   * @return the string tag
   */
  public String tag() {
    return tag;
  }

  /**
   * Resolves a type from its string tag (case-insensitive).
   *
   * @param tag the string tag, e.g. {@code "direct"}
   * @return the matching type
   * @throws IllegalArgumentException if no type has the given tag
   */
  public static MessageType fromTag(String tag) {
    if (tag != null) {
      String normalized = tag.toLowerCase(Locale.ROOT);
      for (MessageType type : values()) {
        if (type.tag.equals(normalized)) {
          return type;
        }
      }
    }
    throw new IllegalArgumentException("Unknown message type: " + tag);
  }
}
