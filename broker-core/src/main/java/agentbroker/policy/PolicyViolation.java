package agentbroker.policy;

import java.util.Objects;

/**
 * A single reason a message was refused admission.
 *
 * @param policyName name of the policy that was violated, e.g. {@code "no_pii"}
 * @param reason     human-readable explanation
 */
public record PolicyViolation(String policyName, String reason) {
  public PolicyViolation {
    Objects.requireNonNull(policyName, "policyName");
    Objects.requireNonNull(reason, "reason");
  }

  /**
   * Formats this violation as it appears in rejection replies.
   *
   * @return {@code Policy '<name>': <reason>}
   */
  public String describe() {
    return "Policy '" + policyName + "': " + reason;
  }
}
