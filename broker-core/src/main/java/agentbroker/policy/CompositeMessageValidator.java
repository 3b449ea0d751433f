package agentbroker.policy;

import agentbroker.MessageEnvelope;
import agentbroker.spi.MessageValidator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Validator that runs every registered {@link MessagePolicy} in registration order and rejects
 * the message if any of them reports a violation. All violations are collected, so the sender
 * sees every problem at once.
 *
 * <p>Policies run on the calling thread; the returned stage is already complete.
 */
public final class CompositeMessageValidator implements MessageValidator {
  private final List<MessagePolicy> policies = new ArrayList<>();

  public CompositeMessageValidator() {
  }

  public CompositeMessageValidator(List<MessagePolicy> policies) {
    Objects.requireNonNull(policies, "policies");
    policies.forEach(this::register);
  }

  /**
   * Appends a policy.
   *
   * @param policy the policy
   * @return this validator
   */
  public CompositeMessageValidator register(MessagePolicy policy) {
    policies.add(Objects.requireNonNull(policy, "policy"));
    return this;
  }

  public List<MessagePolicy> policies() {
    return Collections.unmodifiableList(policies);
  }

  @Override
  public CompletionStage<ValidationResult> validate(MessageEnvelope envelope, ValidationContext context) {
    List<PolicyViolation> violations = new ArrayList<>();
    for (MessagePolicy policy : policies) {
      Optional<PolicyViolation> violation = policy.check(envelope, context);
      violation.ifPresent(violations::add);
    }
    ValidationResult result = violations.isEmpty()
        ? ValidationResult.accepted()
        : ValidationResult.rejected(violations);
    return CompletableFuture.completedFuture(result);
  }
}
