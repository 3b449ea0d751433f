package agentbroker.model;

import agentbroker.MessageEnvelope;

import java.util.Objects;

/**
 * Read-only view of a persisted message together with its delivery state.
 *
 * @see agentbroker.spi.MessageStore#queryFailed
 */
public record StoredMessage(
    MessageEnvelope envelope,
    DeliveryState state,
    int retryCount
) {
  public StoredMessage {
    Objects.requireNonNull(envelope, "envelope");
    Objects.requireNonNull(state, "state");
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount must be >= 0");
    }
  }

  public String messageId() {
    return envelope.messageId();
  }
}
