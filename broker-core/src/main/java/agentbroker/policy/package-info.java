/**
 * Admission policy model and a composable, rule-based validator.
 *
 * <p>{@link agentbroker.policy.CompositeMessageValidator} aggregates
 * {@link agentbroker.policy.MessagePolicy} rules such as
 * {@link agentbroker.policy.PatternPolicy} and
 * {@link agentbroker.policy.MaxPayloadLengthPolicy}.
 */
package agentbroker.policy;
