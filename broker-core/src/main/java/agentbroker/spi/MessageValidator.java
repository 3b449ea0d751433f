package agentbroker.spi;

import agentbroker.MessageEnvelope;
import agentbroker.policy.ValidationContext;
import agentbroker.policy.ValidationResult;

import java.util.concurrent.CompletionStage;

/**
 * Admission gate consulted by the broker before a message is queued.
 *
 * <p>Validation may be asynchronous (e.g. a remote moderation call); the broker admits or
 * rejects once the returned stage completes. Exceptional completion propagates to the
 * sender's {@code sendMessage} future; it is not treated as a rejection.
 *
 * @see agentbroker.policy.CompositeMessageValidator
 */
@FunctionalInterface
public interface MessageValidator {

  /**
   * Validates a message.
   *
   * @param envelope the message under review
   * @param context  timestamp and recent conversation history
   * @return stage completing with the validation result
   */
  CompletionStage<ValidationResult> validate(MessageEnvelope envelope, ValidationContext context);
}
