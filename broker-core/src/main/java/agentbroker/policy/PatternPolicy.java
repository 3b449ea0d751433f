package agentbroker.policy;

import agentbroker.MessageEnvelope;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Rejects payloads containing a match for a regular expression.
 *
 * <pre>{@code
 * new PatternPolicy("no_pii", PatternPolicy.EMAIL, "contains email")
 * }</pre>
 */
public final class PatternPolicy implements MessagePolicy {
  /** Loose e-mail address matcher. */
  public static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");

  private final String policyName;
  private final Pattern pattern;
  private final String reason;

  public PatternPolicy(String policyName, Pattern pattern, String reason) {
    this.policyName = Objects.requireNonNull(policyName, "policyName");
    this.pattern = Objects.requireNonNull(pattern, "pattern");
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  @Override
  public Optional<PolicyViolation> check(MessageEnvelope envelope, ValidationContext context) {
    if (pattern.matcher(envelope.payload()).find()) {
      return Optional.of(new PolicyViolation(policyName, reason));
    }
    return Optional.empty();
  }
}
