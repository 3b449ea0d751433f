package agentbroker.policy;

import agentbroker.MessageEnvelope;

import java.util.Optional;

/**
 * Rejects payloads longer than a fixed number of characters.
 */
public final class MaxPayloadLengthPolicy implements MessagePolicy {
  public static final String NAME = "max_payload_length";

  private final int maxLength;

  public MaxPayloadLengthPolicy(int maxLength) {
    if (maxLength <= 0) {
      throw new IllegalArgumentException("maxLength must be > 0");
    }
    this.maxLength = maxLength;
  }

  @Override
  public Optional<PolicyViolation> check(MessageEnvelope envelope, ValidationContext context) {
    int length = envelope.payload().length();
    if (length > maxLength) {
      return Optional.of(new PolicyViolation(NAME,
          "payload is " + length + " characters, limit is " + maxLength));
    }
    return Optional.empty();
  }
}
