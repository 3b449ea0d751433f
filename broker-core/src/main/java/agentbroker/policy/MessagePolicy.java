package agentbroker.policy;

import agentbroker.MessageEnvelope;

import java.util.Optional;

/**
 * A single synchronous admission rule, combined into a validator by
 * {@link CompositeMessageValidator}.
 */
@FunctionalInterface
public interface MessagePolicy {

  /**
   * Checks one message.
   *
   * @param envelope the message under review
   * @param context  timestamp and recent conversation history
   * @return a violation, or empty if the message complies
   */
  Optional<PolicyViolation> check(MessageEnvelope envelope, ValidationContext context);
}
