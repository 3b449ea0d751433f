package agentbroker.policy;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of validating a message: admissible or not, with the violations found.
 *
 * <p>A result may be valid and still carry violations when a validator reports advisory
 * findings; only {@link #valid()} decides admission.
 */
public record ValidationResult(boolean valid, List<PolicyViolation> violations) {
  private static final ValidationResult VALID = new ValidationResult(true, List.of());

  public ValidationResult {
    violations = List.copyOf(Objects.requireNonNull(violations, "violations"));
  }

  public static ValidationResult accepted() {
    return VALID;
  }

  public static ValidationResult rejected(List<PolicyViolation> violations) {
    return new ValidationResult(false, violations);
  }

  public static ValidationResult rejected(String policyName, String reason) {
    return rejected(List.of(new PolicyViolation(policyName, reason)));
  }
}
