package agentbroker.policy;

import agentbroker.MessageEnvelope;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Information handed to a validator alongside the message under review.
 *
 * @param timestamp           time the validation was requested
 * @param conversationHistory recent messages exchanged between sender and recipient,
 *                            oldest first; empty when no store is configured or the lookup failed
 */
public record ValidationContext(Instant timestamp, List<MessageEnvelope> conversationHistory) {
  public ValidationContext {
    Objects.requireNonNull(timestamp, "timestamp");
    conversationHistory = List.copyOf(Objects.requireNonNull(conversationHistory, "conversationHistory"));
  }

  public static ValidationContext withoutHistory(Instant timestamp) {
    return new ValidationContext(timestamp, List.of());
  }
}
